/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.config;

import com.camlink.common.config.CamLinkProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.AbstractEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies Spring's {@link Environment} into the static {@link CamLinkProperties}
 * singleton so plain objects can read settings.
 *
 * <p>Only enumerable sources (application.properties, system properties,
 * environment variables) are captured.</p>
 */
@Component
public class CamLinkPropertiesInitializer {

    private static final Logger log = LoggerFactory.getLogger(CamLinkPropertiesInitializer.class);

    private final Environment environment;

    public CamLinkPropertiesInitializer(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void init() {
        Map<String, String> props = new LinkedHashMap<>();

        for (PropertySource<?> source : ((AbstractEnvironment) environment).getPropertySources()) {
            if (!(source instanceof EnumerablePropertySource<?> enumerable)) continue;
            for (String key : enumerable.getPropertyNames()) {
                if (props.containsKey(key)) continue;
                try {
                    String resolved = environment.getProperty(key);
                    if (resolved != null) props.put(key, resolved);
                } catch (IllegalArgumentException e) {
                    log.debug("Skipping unresolvable property {}: {}", key, e.getMessage());
                }
            }
        }

        CamLinkProperties.init(props);
        log.info("CamLinkProperties initialized with {} properties", props.size());

        if (log.isDebugEnabled()) {
            props.entrySet().stream()
                    .filter(e -> e.getKey().startsWith("camlink."))
                    .forEach(e -> log.debug("  {} = {}", e.getKey(), e.getValue()));
        }
    }
}
