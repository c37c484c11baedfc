package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Jackson configuration.
 *
 * <p>Ledger metadata and notification payloads go through one canonical mapper: sorted properties and map keys,
 * ISO timestamps, unknown properties ignored so rows written by an older release still read back.</p>
 */
@Configuration
public class JacksonConfig {

    /**
     * Canonical ObjectMapper; the only mapper bean in the context.
     *
     * @param builder Spring's prototype mapper builder
     * @return canonical mapper
     */
    @Bean("canonicalObjectMapper")
    public ObjectMapper canonicalObjectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder
                .modules(new JavaTimeModule())
                .featuresToEnable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Bean
    Jackson2ObjectMapperBuilderCustomizer javaTimeModule() {
        return builder -> builder.modules(new JavaTimeModule());
    }
}
