package app.lexis.core.config;

import app.lexis.core.review.algorithm.ReviewClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public ReviewClock reviewClock(SchedulerProps props) {
        ReviewClock clock = ReviewClock.system(props.accelerated());
        if (clock.isAccelerated()) {
            log.warn("Accelerated time is on factor={}: 1 min = 0.06s, 10 min = 0.6s, 1 day = 86.4s",
                    clock.accelerationFactor());
        }
        return clock;
    }
}
