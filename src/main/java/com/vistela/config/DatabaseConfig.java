package com.vistela.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class DatabaseConfig {

    /**
     * The pool starts on the first borrowed connection, so the application comes up
     * even when the database settings are missing.
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(DatabaseProps props) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("vistela-db");
        dataSource.setMaximumPoolSize(props.maximumPoolSize());
        dataSource.setConnectionTimeout(props.connectionTimeout().toMillis());

        if (props.isComplete()) {
            dataSource.setJdbcUrl(props.jdbcUrl());
            dataSource.setUsername(props.user());
            dataSource.setPassword(props.password());
            log.info("Database configured - pool size: {}", props.maximumPoolSize());
        } else {
            log.warn("Database settings incomplete; video record operations will fail until they are set");
        }
        return dataSource;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
