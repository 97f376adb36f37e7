package com.secretgateway.gateway;

import com.secretgateway.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.secretgateway")
public class SecretGatewayApp {

    private static final Logger log = LoggerFactory.getLogger(SecretGatewayApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        if (!config.crypto().hasMasterKey()) {
            log.warn("No master key configured. Set crypto.master-key in ~/.secretgateway/config.yaml "
                    + "or SECRETGATEWAY_MASTER_KEY; a random key is used for this process");
        }
        var app = new SpringApplication(SecretGatewayApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.run(args);
    }
}
