package com.vidnyan.ust.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.ust.application.service.ParserRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the UST engine.
 */
@Slf4j
@Configuration
public class UstConfiguration {

    /**
     * ObjectMapper for the canonical JSON form.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available parsers on startup.
     */
    @Bean
    public String logParsers(ParserRegistry registry) {
        log.info("Registered {} language parsers:", registry.listSupportedLanguages().size());
        registry.describe().forEach(info ->
                log.info("  - {} {} ({})", info.name(), info.extensions(), info.parserVersion()));
        return "parsers-logged";
    }
}
