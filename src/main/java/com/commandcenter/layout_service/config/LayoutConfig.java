package com.commandcenter.layout_service.config;

import com.commandcenter.layout_service.engine.LayeredLayoutEngine;
import com.commandcenter.layout_service.engine.LayoutSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LayoutConfig {

    // Bad values fail startup here rather than on the first layout request
    @Bean
    public LayoutSettings layoutSettings(LayoutProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public LayeredLayoutEngine layeredLayoutEngine(LayoutSettings layoutSettings) {
        return new LayeredLayoutEngine(layoutSettings);
    }
}
