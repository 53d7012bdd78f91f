package com.company.silencing.config;

import com.company.silencing.cache.SilenceCache;
import com.company.silencing.matcher.RegexCache;
import com.company.silencing.matcher.SilenceMatcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Configuration
@EnableConfigurationProperties(SilenceProperties.class)
public class SilencingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegexCache regexCache(SilenceProperties properties) {
        return new RegexCache(properties.getMatcher().getRegexCacheSize());
    }

    @Bean
    public SilenceMatcher silenceMatcher(RegexCache regexCache) {
        return new SilenceMatcher(regexCache);
    }

    @Bean
    public SilenceCache silenceCache(Clock clock, SilenceProperties properties) {
        return new SilenceCache(clock, new ReentrantReadWriteLock(),
                properties.getCache().getTombstoneTtl());
    }
}
