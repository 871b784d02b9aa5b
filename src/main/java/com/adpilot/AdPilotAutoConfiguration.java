package com.adpilot;

import com.adpilot.abtest.AbTestRepository;
import com.adpilot.abtest.AbTestStore;
import com.adpilot.abtest.JpaAbTestStore;
import com.adpilot.config.AdPilotProperties;
import com.adpilot.queue.JobRepository;
import com.adpilot.queue.internal.JobMetrics;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.adpilot")
@ComponentScan("com.adpilot")
@EnableScheduling
@EnableConfigurationProperties(AdPilotProperties.class)
public class AdPilotAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "adpilotObjectMapper")
    public ObjectMapper adpilotObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public JobMetrics adpilotJobMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        return new JobMetrics(jobRepository, meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(AbTestStore.class)
    public AbTestStore adpilotAbTestStore(AbTestRepository abTestRepository,
            @Qualifier("adpilotObjectMapper") ObjectMapper objectMapper) {
        return new JpaAbTestStore(abTestRepository, objectMapper);
    }
}
