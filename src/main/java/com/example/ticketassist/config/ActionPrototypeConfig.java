package com.example.ticketassist.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.ticketassist.embedding.EmbeddingClient;
import com.example.ticketassist.pipeline.ActionPrototypeIndex;
import com.example.ticketassist.pipeline.ActionPrototypes;

/**
 * Embeds the action prototypes during context startup, so a broken embedding model fails the
 * boot rather than the first ticket.
 */
@Configuration
public class ActionPrototypeConfig {

    @Bean
    ActionPrototypeIndex actionPrototypeIndex(EmbeddingClient embeddingClient) {
        return ActionPrototypeIndex.embed(embeddingClient, ActionPrototypes.DEFAULT);
    }
}
