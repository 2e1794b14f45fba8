package com.example.resumeindex;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@SpringBootApplication
public class ResumeIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeIndexApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // provider timeouts live here; the core never retries
    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder,
                                              @Value("${openai.timeout-seconds:60}") long timeoutSeconds) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
