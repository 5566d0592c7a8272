package com.wobble.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.core.framework.ReflectiveTestFramework;
import com.wobble.core.framework.TestFrameworkFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WobbleConfig {

    @Bean
    public TestFrameworkFactory testFrameworkFactory() {
        return ReflectiveTestFramework::new;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
