package app.lexis.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param accelerated run every scheduler-facing duration 1000x faster (1 day = 86.4s)
 */
@ConfigurationProperties(prefix = "app.scheduler")
public record SchedulerProps(
        boolean accelerated
) {}
