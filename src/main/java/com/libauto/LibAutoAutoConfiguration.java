package com.libauto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.libauto.config.LibAutoProperties;
import com.libauto.gateway.ExternalSyncTarget;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.gateway.LoggingExternalSyncTarget;
import com.libauto.gateway.NoOpLibraryDataGateway;
import com.libauto.internal.LibAutoMetrics;
import com.libauto.queue.QueueItemRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@AutoConfiguration(
        after = JacksonAutoConfiguration.class,
        before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class },
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@AutoConfigurationPackage(basePackages = "com.libauto")
@ComponentScan(basePackages = "com.libauto", excludeFilters = {
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class),
        @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class) })
@EnableScheduling
@EnableConfigurationProperties(LibAutoProperties.class)
public class LibAutoAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper libautoObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock libautoClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ExternalSyncTarget.class)
    public ExternalSyncTarget libautoExternalSyncTarget() {
        return new LoggingExternalSyncTarget();
    }

    @Bean
    @ConditionalOnMissingBean(LibraryDataGateway.class)
    public LibraryDataGateway libautoLibraryDataGateway() {
        return new NoOpLibraryDataGateway();
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public LibAutoMetrics libautoMetrics(
            QueueItemRepository queueItemRepository,
            MeterRegistry meterRegistry,
            LibAutoProperties properties) {
        return new LibAutoMetrics(queueItemRepository, meterRegistry, properties.getQueues().asMap().keySet());
    }
}
