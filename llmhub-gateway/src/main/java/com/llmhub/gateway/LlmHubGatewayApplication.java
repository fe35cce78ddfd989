package com.llmhub.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LlmHubGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmHubGatewayApplication.class, args);
    }
}
