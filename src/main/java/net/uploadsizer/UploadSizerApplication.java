/**
 * Main application class for the upload sizer
 *
 * Features:
 * - Watches an uploads directory and derives WordPress image sizes for new files
 * - Runs without a web server; health and metrics come from Actuator
 * - Enables scheduling for catalog refresh and stats reporting
 */

package net.uploadsizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@SpringBootApplication
@EnableScheduling
public class UploadSizerApplication {

    private static final int SCHEDULER_POOL_SIZE = 2;
    private static final int SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String SCHEDULER_THREAD_PREFIX = "PipelineScheduler-";

    public static void main(String[] args) {
        SpringApplication.run(UploadSizerApplication.class, args);
    }

    /**
     * Scheduler for {@code @Scheduled} jobs, kept separate from the derivation workers.
     *
     * @return task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }
}
