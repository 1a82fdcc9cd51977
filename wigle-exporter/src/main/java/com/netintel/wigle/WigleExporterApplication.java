package com.netintel.wigle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class WigleExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(WigleExporterApplication.class, args);
    }
}
