package com.di.scorenova.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Selects the scheduled batch source from {@code scorenova.source.type}.
 */
@Configuration
public class RecordSourceConfig {

    @Bean
    @ConditionalOnProperty(name = "scorenova.source.type", havingValue = "synthetic", matchIfMissing = true)
    public BatchRecordSource syntheticRecordSource(RecordSourceProperties props) {
        return new SyntheticRecordSource(props.getSyntheticCount(), props.getSeed(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(name = "scorenova.source.type", havingValue = "json-file")
    public BatchRecordSource jsonFileRecordSource(RecordSourceProperties props) {
        Path path = props.getPath() != null ? Path.of(props.getPath()) : null;
        return new JsonFileRecordSource(path, new ObjectMapper().registerModule(new JavaTimeModule()));
    }
}
