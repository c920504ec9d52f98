package com.vaultengine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine limits, oracle prices and the clock the service stamps operation contexts with.
 */
@Configuration
@EnableConfigurationProperties({EngineProperties.class, OracleProperties.class})
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
