package com.lumen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.persistence.JsonFileSessionRepository;
import com.lumen.persistence.SessionRepository;
import com.lumen.retry.RetryExecutor;
import com.lumen.service.api.ExternalStateGateway;
import com.lumen.service.impl.ExternalStateGatewayImpl;
import com.lumen.transport.OkHttpTransport;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the infrastructure pieces of the tutoring core: the retry scheduler, the
 * training-backend gateway and session persistence.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(LumenProperties.class)
public class TutorConfiguration {

    /**
     * Single daemon thread that only fires backoff timers; the retried work itself runs on
     * OkHttp's dispatcher threads.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler retryScheduler() {
        return Schedulers.newSingle("retry-scheduler", true);
    }

    @Bean
    public RetryExecutor retryExecutor(Scheduler retryScheduler) {
        return new RetryExecutor(retryScheduler);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExternalStateGateway externalStateGateway(LumenProperties properties,
                                                     RetryExecutor retryExecutor,
                                                     ObjectMapper objectMapper) {
        var upstream = properties.upstream();
        return new ExternalStateGatewayImpl(
                OkHttpTransport.withTimeout(upstream.timeout()),
                retryExecutor,
                objectMapper,
                upstream);
    }

    @Bean
    public SessionRepository sessionRepository(LumenProperties properties, ObjectMapper objectMapper) {
        return new JsonFileSessionRepository(objectMapper, Path.of(properties.storage().dir()));
    }
}
