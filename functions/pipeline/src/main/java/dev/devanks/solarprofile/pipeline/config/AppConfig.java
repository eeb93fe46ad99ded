package dev.devanks.solarprofile.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class AppConfig {

    // Stage timestamps and import refresh times are taken from this clock
    @Bean
    public Clock clock() {
        log.info("Initializing UTC clock bean.");
        return Clock.systemUTC();
    }
}
