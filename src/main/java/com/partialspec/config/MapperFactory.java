package com.partialspec.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Creates the Jackson mappers shared by the loader and the serializer, so JSON and YAML
 * documents are read and written with one consistent configuration.
 */
@Configuration
public class MapperFactory {

    /**
     * The JSON mapper. Marked primary because {@link YAMLMapper} is an {@link ObjectMapper} too.
     */
    @Bean
    @Primary
    public ObjectMapper jsonMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * The YAML mapper, without the leading {@code ---} document marker.
     */
    @Bean
    public YAMLMapper yamlMapper() {
        return YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
    }
}
