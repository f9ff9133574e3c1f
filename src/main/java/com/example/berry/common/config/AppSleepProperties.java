package com.example.berry.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sleep")
public class AppSleepProperties {

    private long timeoutMs = 120000;

    private String backlightDir = "/sys/class/backlight";
}
