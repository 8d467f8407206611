package com.autonomous.cos.config;

import com.autonomous.cos.service.ExecutorTickSource;
import com.autonomous.cos.service.TickSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId scheduleZone(@Value("${cos.zone:}") String zone) {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    @Bean(destroyMethod = "shutdown")
    public TickSource tickSource() {
        return new ExecutorTickSource();
    }
}
