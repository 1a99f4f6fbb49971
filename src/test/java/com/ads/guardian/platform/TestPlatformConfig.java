package com.ads.guardian.platform;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestPlatformConfig {

    @Bean
    @Primary
    public InMemoryAdsPlatform inMemoryAdsPlatform() {
        return new InMemoryAdsPlatform();
    }
}
