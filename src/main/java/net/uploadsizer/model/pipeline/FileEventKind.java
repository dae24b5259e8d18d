package net.uploadsizer.model.pipeline;

public enum FileEventKind {
    ADD,
    MODIFY,
    DELETE
}
