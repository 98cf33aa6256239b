package com.devgate.gateway;

import com.devgate.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * DevGate debug gateway: an authenticated HTTP API for listing and running entities, with
 * server-sent-events streaming of their execution.
 *
 * <p>Every {@code /v1} request needs a bearer token from the configured Microsoft Entra ID
 * tenant ({@code DEVUI_AZURE_AD_*} variables). {@code /health} and the actuator endpoints stay
 * open.
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class DebugGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(DebugGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DebugGatewayApplication.class, args);
        log.info("DevGate debug gateway started");
    }
}
