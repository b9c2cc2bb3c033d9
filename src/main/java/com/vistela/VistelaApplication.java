package com.vistela;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VistelaApplication {

    public static void main(String[] args) {
        SpringApplication.run(VistelaApplication.class, args);
    }
}
