/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.camlink.web")
public class CamLinkApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CamLinkApplication.class);
        app.setRegisterShutdownHook(true); // SIGINT/SIGTERM must reach ContextClosedEvent
        app.run(args);
    }
}
