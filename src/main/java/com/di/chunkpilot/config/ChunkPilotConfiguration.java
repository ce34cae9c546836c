package com.di.chunkpilot.config;

import com.di.chunkpilot.agent.planner.CaffeineDecisionCache;
import com.di.chunkpilot.agent.planner.DecisionCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Infrastructure beans: a fallback meter registry when no monitoring system is on the classpath,
 * and the in-process decision cache.
 * Disable the cache with {@code chunkpilot.cache.enabled=false}.
 */
@Slf4j
@Configuration
public class ChunkPilotConfiguration {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(DecisionCache.class)
    @ConditionalOnProperty(name = "chunkpilot.cache.enabled", havingValue = "true", matchIfMissing = true)
    public DecisionCache decisionCache(
            @Value("${chunkpilot.cache.max-size:1000}") long maxSize,
            @Value("${chunkpilot.cache.expire-after-write:PT30M}") Duration expireAfterWrite) {
        log.info("[PLANNER] decision cache enabled: maxSize={} expireAfterWrite={}", maxSize, expireAfterWrite);
        return new CaffeineDecisionCache(maxSize, expireAfterWrite);
    }
}
