package com.example.ticketassist.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.reranker")
public record RerankerProperties(
    @DefaultValue("http://localhost:8082") String baseUrl,
    @DefaultValue("cross-encoder/ms-marco-MiniLM-L-6-v2") String model,
    @DefaultValue("30s") Duration timeout
) {}
