package com.example.ticketassist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.actions")
public record ActionProperties(
    @DefaultValue("0.5") double threshold
) {}
