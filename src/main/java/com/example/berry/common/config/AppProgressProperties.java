package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.progress")
public class AppProgressProperties {

    private String file = System.getProperty("user.home") + "/berry/progress.json";

    private long saveIntervalMs = 10000;

    private int expiryHours = 24;
}
