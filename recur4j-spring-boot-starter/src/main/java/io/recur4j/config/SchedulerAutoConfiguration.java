package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobScheduler;
import io.recur4j.core.ScheduledJob;
import io.recur4j.internal.executor.ExecutorJobScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the job scheduler.
 *
 * <p>Every {@link ScheduledJob} bean (usually a {@code JobConfig} built with {@code JobBuilder.of(...)})
 * is registered and started with the application context.
 */
@AutoConfiguration
@ConditionalOnClass(JobScheduler.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(SchedulerProperties props, ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new ExecutorJobScheduler(props, objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobSchedulerLifecycle jobSchedulerLifecycle(JobScheduler scheduler,
                                                       ObjectProvider<ScheduledJob> jobsProvider,
                                                       SchedulerProperties props) {
        List<ScheduledJob> jobs = jobsProvider.orderedStream().toList();
        return new JobSchedulerLifecycle(scheduler, jobs, props);
    }
}
