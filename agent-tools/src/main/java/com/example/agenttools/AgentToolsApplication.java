package com.example.agenttools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentToolsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentToolsApplication.class, args);
    }
}
