package com.hiredoc.infrastructure.extraction;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ExtractionSettings.class)
public class ExtractionConfig {

    @Bean
    public Clock extractionClock() {
        return Clock.systemDefaultZone();
    }
}
