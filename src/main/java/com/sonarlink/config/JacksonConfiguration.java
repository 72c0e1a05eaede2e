package com.sonarlink.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The one {@link ObjectMapper} of the application.
 *
 * <p>SonarQube payloads are never bound to classes: they are read into {@code JsonNode} trees,
 * cached, copied to the shared tier and handed back to callers. The mapper therefore has to keep
 * numbers exactly as SonarQube sent them. Admin responses are the only typed output.</p>
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return sonarLinkObjectMapper();
    }

    static ObjectMapper sonarLinkObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // measures such as coverage or debt ratios must not pass through a double
        mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

        // unset optional fields, e.g. sharedCache, are left out of admin responses
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        return mapper;
    }
}
