package com.codenames.backend;

import com.codenames.backend.config.CodenamesProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CodenamesProperties.class)
public class CodenamesBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodenamesBackendApplication.class, args);
    }

}
