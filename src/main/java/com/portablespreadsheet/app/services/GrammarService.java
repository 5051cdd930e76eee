package com.portablespreadsheet.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Registration and lookup of the notations words are rendered to.
 * Cells built before a registration do not gain the new notation.
 */
@Service
public class GrammarService {

    private static final Logger log = LoggerFactory.getLogger(GrammarService.class);

    private final GrammarRegistry grammars;

    @Autowired
    public GrammarService(GrammarRegistry grammars) {
        this.grammars = grammars;
    }

    public Set<String> listNotations() {
        return grammars.listRegisteredNames();
    }

    public JsonNode getGrammar(String name) {
        return grammars.getSource(name);
    }

    public void register(String name, JsonNode grammar) {
        grammars.register(grammar, name);
        log.debug("Notations after registering {}: {}", name, grammars.listRegisteredNames());
    }

    public void remove(String name) {
        grammars.remove(name);
        log.debug("Notations after removing {}: {}", name, grammars.listRegisteredNames());
    }

    public boolean validate(JsonNode grammar) {
        boolean valid = grammars.validate(grammar);
        log.debug("Grammar validation result: {}", valid);
        return valid;
    }
}
