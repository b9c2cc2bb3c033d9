package com.vistela.config;

import com.vistela.storage.S3ClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    @Bean
    public S3ClientFactory s3ClientFactory() {
        return new S3ClientFactory();
    }
}
