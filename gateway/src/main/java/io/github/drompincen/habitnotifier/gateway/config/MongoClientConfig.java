package io.github.drompincen.habitnotifier.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Bounds every Mongo round trip so a hung server surfaces as a store failure instead
 * of blocking scheduler threads.
 */
@Configuration
public class MongoClientConfig {

    @Bean
    MongoClientSettingsBuilderCustomizer mongoTimeouts(@Value("${habitnotifier.store.timeout-ms:5000}") int timeoutMs) {
        return builder -> builder
                .applyToSocketSettings(s -> s
                        .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(c -> c.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS));
    }
}
