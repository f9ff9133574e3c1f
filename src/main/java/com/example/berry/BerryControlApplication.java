package com.example.berry;

import com.example.berry.common.config.AppAutoPauseProperties;
import com.example.berry.common.config.AppCatalogProperties;
import com.example.berry.common.config.AppConnectionProperties;
import com.example.berry.common.config.AppLibrespotProperties;
import com.example.berry.common.config.AppPlaybackProperties;
import com.example.berry.common.config.AppProgressProperties;
import com.example.berry.common.config.AppSleepProperties;
import com.example.berry.common.config.AppUiProperties;
import com.example.berry.common.config.AppVolumeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppLibrespotProperties.class,
        AppConnectionProperties.class,
        AppPlaybackProperties.class,
        AppVolumeProperties.class,
        AppAutoPauseProperties.class,
        AppSleepProperties.class,
        AppProgressProperties.class,
        AppCatalogProperties.class,
        AppUiProperties.class
})
public class BerryControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(BerryControlApplication.class, args);
    }
}
