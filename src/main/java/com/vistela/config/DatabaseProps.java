package com.vistela.config;

import com.vistela.exception.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the videos database. Checked on first use rather than at startup.
 *
 * @param url optional JDBC URL; when set, {@code host}, {@code port} and {@code name} are ignored
 */
@ConfigurationProperties(prefix = "vistela.database")
public record DatabaseProps(
        String host,
        @DefaultValue("5432") int port,
        String name,
        String user,
        String password,
        String url,
        @DefaultValue("10") int maximumPoolSize,
        @DefaultValue("5s") Duration connectionTimeout
) {

    public boolean isComplete() {
        return missingProperties().isEmpty();
    }

    /**
     * @throws ConfigurationException naming every required property that is unset
     */
    public void requireComplete() {
        List<String> missing = missingProperties();
        if (!missing.isEmpty()) {
            throw new ConfigurationException(missing);
        }
    }

    public String jdbcUrl() {
        if (StringUtils.hasText(url)) {
            return url;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    private List<String> missingProperties() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(url)) {
            if (!StringUtils.hasText(host)) {
                missing.add("vistela.database.host");
            }
            if (!StringUtils.hasText(name)) {
                missing.add("vistela.database.name");
            }
        }
        if (!StringUtils.hasText(user)) {
            missing.add("vistela.database.user");
        }
        if (!StringUtils.hasText(password)) {
            missing.add("vistela.database.password");
        }
        return missing;
    }
}
