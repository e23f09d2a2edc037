package com.commandcenter.layout_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LayoutServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayoutServiceApplication.class, args);
    }
}
