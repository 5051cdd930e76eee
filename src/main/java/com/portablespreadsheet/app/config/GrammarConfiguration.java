package com.portablespreadsheet.app.config;

import com.portablespreadsheet.app.grammars.GrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Exposes the process-wide grammar registry, with the extra grammars
 * named in the configuration registered on top of the built-in ones.
 */
@Configuration
@EnableConfigurationProperties(SpreadsheetProperties.class)
public class GrammarConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GrammarConfiguration.class);

    @Bean
    public GrammarRegistry grammarRegistry(SpreadsheetProperties properties) {
        GrammarRegistry registry = GrammarRegistry.getDefault();
        for (Map.Entry<String, String> extra : properties.getExtraGrammars().entrySet()) {
            if (registry.isRegistered(extra.getKey())) {
                log.debug("Notation {} is already registered", extra.getKey());
                continue;
            }
            registry.register(GrammarRegistry.loadResource(extra.getValue()), extra.getKey());
        }
        log.info("Notations available: {}", registry.listRegisteredNames());
        return registry;
    }
}
