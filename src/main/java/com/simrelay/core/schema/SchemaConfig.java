package com.simrelay.core.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the {@link SchemaIndex} once at startup. A {@link SchemaLoadException}
 * here fails context refresh, so the server never runs without a schema.
 */
@Configuration
public class SchemaConfig {

    @Bean
    public SchemaLoader schemaLoader(ObjectMapper objectMapper) {
        return new SchemaLoader(objectMapper);
    }

    @Bean
    public SchemaIndex schemaIndex(SchemaLoader loader, SchemaProperties properties, ResourceLoader resourceLoader) {
        return loader.load(resourceLoader.getResource(properties.getLocation()));
    }
}
