/**
 * Main application class for the sales coach insights service
 *
 * Features:
 * - Regenerates account-level insight snapshots from stored call analyses
 * - Streams account research briefs over SSE
 * - Schedules periodic pruning of rate-limit windows
 */

package net.salescoach;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@SpringBootApplication(exclude = {
    // Disable SQL initialization to prevent automatic schema.sql execution
    org.springframework.boot.jdbc.autoconfigure.DataSourceInitializationAutoConfiguration.class
})
@EnableScheduling
public class SalesCoachInsightsApplication {

    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "AppScheduler-";

    public static void main(String[] args) {
        SpringApplication.run(SalesCoachInsightsApplication.class, args);
    }

    /**
     * Dedicated scheduler for {@code @Scheduled} maintenance work.
     *
     * @return application task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }

    /**
     * System UTC clock; rate-limit windows and snapshot timestamps read time through it.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
