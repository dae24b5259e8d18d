package net.uploadsizer.config;

import net.uploadsizer.support.watch.UploadDirectoryWatcher;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the uploads root is still being watched.
 */
@Component("uploadWatchHealthIndicator")
public class UploadWatchHealthIndicator implements HealthIndicator {

    private final UploadDirectoryWatcher watcher;

    public UploadWatchHealthIndicator(UploadDirectoryWatcher watcher) {
        this.watcher = watcher;
    }

    @Override
    public Health health() {
        String root = watcher.getRoot().toString();
        if (!watcher.isRootAccessible()) {
            return Health.down()
                .withDetail("watch_status", "root_inaccessible")
                .withDetail("root", root)
                .build();
        }
        if (!watcher.isRunning()) {
            return Health.down()
                .withDetail("watch_status", "not_running")
                .withDetail("root", root)
                .build();
        }
        return Health.up()
            .withDetail("watch_status", "watching")
            .withDetail("root", root)
            .withDetail("directories", watcher.watchedDirectoryCount())
            .build();
    }
}
