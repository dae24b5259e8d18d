package net.uploadsizer.service.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.exception.SizeCatalogUnavailableException;
import net.uploadsizer.model.image.SizeSpec;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads sizes from a JSON export of {@code wp_get_additional_image_sizes()}:
 * <pre>{"thumbnail": {"width": 150, "height": 150, "crop": true}, ...}</pre>
 *
 * <p>Numbers may be given as integer strings and {@code crop} as {@code 0/1} or {@code "1"}. Entries with
 * both bounds at 0 (full-size placeholders) are dropped.</p>
 */
@Slf4j
public class JsonFileSizeCatalogProvider implements SizeCatalogProvider {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileSizeCatalogProvider(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, SizeSpec> fetchSizes() {
        Map<String, Object> raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = objectMapper.readValue(in, OBJECT_MAP);
        } catch (IOException | JacksonException e) {
            throw new SizeCatalogUnavailableException("Cannot read size catalog " + file + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new SizeCatalogUnavailableException("Size catalog " + file + " is empty");
        }

        Map<String, SizeSpec> sizes = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (!(value instanceof Map<?, ?> entry)) {
                log.warn("Ignoring size '{}' in {}: not an object", name, file);
                return;
            }
            int width = toInt(entry.get("width"));
            int height = toInt(entry.get("height"));
            if (width < 0 || height < 0) {
                log.warn("Ignoring size '{}' in {}: invalid bounds {}x{}", name, file, entry.get("width"), entry.get("height"));
                return;
            }
            if (width == 0 && height == 0) {
                log.warn("Ignoring size '{}' in {}: both bounds are 0", name, file);
                return;
            }
            sizes.put(name, new SizeSpec(name, width, height, toBoolean(entry.get("crop"))));
        });

        if (sizes.isEmpty()) {
            throw new SizeCatalogUnavailableException("Size catalog " + file + " has no usable sizes");
        }
        return sizes;
    }

    @Override
    public String describe() {
        return "json:" + file;
    }

    private static int toInt(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * WordPress stores crop as a bool, 0/1, or a two-element position array; any array counts as crop.
     */
    private static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        String text = value.toString().trim();
        return "1".equals(text) || "true".equalsIgnoreCase(text);
    }
}
