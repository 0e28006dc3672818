package com.example.modelbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelBridgeApplication.class, args);
    }
}
