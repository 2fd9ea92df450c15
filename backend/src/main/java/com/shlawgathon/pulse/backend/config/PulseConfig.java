package com.shlawgathon.pulse.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PulseConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
