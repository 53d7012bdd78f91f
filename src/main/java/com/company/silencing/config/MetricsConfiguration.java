package com.company.silencing.config;

import com.company.silencing.cache.SilenceCache;
import com.company.silencing.matcher.RegexCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Silencing gauges. Counters are registered where they are incremented.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SilenceCache silenceCache;
    private final RegexCache regexCache;

    @Bean
    public MeterBinder silencingMetrics() {
        return (reg) -> {
            Gauge.builder("silences.cache.size", silenceCache, SilenceCache::size)
                    .description("Number of pending and active silences held in memory")
                    .register(reg);

            Gauge.builder("silences.regex_cache.size", regexCache, RegexCache::size)
                    .description("Number of compiled matcher patterns")
                    .register(reg);

            log.info("Silencing metrics registered");
        };
    }
}
