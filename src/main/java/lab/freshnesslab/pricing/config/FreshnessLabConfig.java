package lab.freshnesslab.pricing.config;

import java.time.Clock;
import lab.freshnesslab.pricing.domain.Backend;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

@Configuration
@EnableConfigurationProperties(FreshnessLabProperties.class)
public class FreshnessLabConfig implements SchedulingConfigurer {

    private final FreshnessLabProperties properties;

    public FreshnessLabConfig(FreshnessLabProperties properties) {
        this.properties = properties;
    }

    @Bean
    Clock labClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "probeTaskExecutor")
    ThreadPoolTaskExecutor probeTaskExecutor() {
        int maxWorkers = Backend.values().length
                * Math.max(properties.getIndexedConcurrency(), properties.getFloorConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxWorkers);
        executor.setMaxPoolSize(maxWorkers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("probe-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "loopScheduler")
    ThreadPoolTaskScheduler loopScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, properties.getLoopSchedulerPoolSize()));
        scheduler.setThreadNamePrefix("lab-loop-");
        scheduler.initialize();
        return scheduler;
    }

    // Separate from the loop scheduler so that cancelling a refresh wait never touches other loops.
    @Bean(name = "refreshScheduler")
    ThreadPoolTaskScheduler refreshScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("mv-refresh-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(loopScheduler());
    }
}
