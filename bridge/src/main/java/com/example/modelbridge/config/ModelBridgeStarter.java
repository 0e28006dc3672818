package com.example.modelbridge.config;

import com.example.modelbridge.http.ModelBridge;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the bridge listeners once the model document is open.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ModelBridgeStarter implements ApplicationRunner {

    private final ModelBridge modelBridge;

    @Override
    public void run(ApplicationArguments args) {
        modelBridge.start();
    }
}
