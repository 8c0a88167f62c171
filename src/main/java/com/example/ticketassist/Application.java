package com.example.ticketassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.ticketassist.config.ActionProperties;
import com.example.ticketassist.config.AppConfig;
import com.example.ticketassist.config.RerankerProperties;
import com.example.ticketassist.config.RetrievalProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    AppConfig.class,
    RetrievalProperties.class,
    RerankerProperties.class,
    ActionProperties.class
})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
