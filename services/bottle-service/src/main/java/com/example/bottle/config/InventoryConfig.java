package com.example.bottle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;

@Configuration
@EnableConfigurationProperties(BottleProperties.class)
public class InventoryConfig {

    @Bean
    public Clock inventoryClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
