package com.example.ticketassist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.llm")
public record AppConfig(
    String provider,
    String model,
    String fallbackProvider,
    String fallbackModel,
    int maxTokens,
    double temperature
) {}
