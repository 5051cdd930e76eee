package com.portablespreadsheet.app.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.portablespreadsheet.app.services.GrammarService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * REST endpoints for the registered notations.
 * "/grammar" is the base path.
 */
@RestController
@RequestMapping("/grammar")
public class GrammarController {

    @Autowired
    private GrammarService grammarService;

    @GetMapping
    public ResponseEntity<Set<String>> listNotations() {
        return ResponseEntity.ok(grammarService.listNotations());
    }

    @GetMapping("/{name}")
    public ResponseEntity<JsonNode> getGrammar(@PathVariable String name) {
        return ResponseEntity.ok(grammarService.getGrammar(name));
    }

    /**
     * POST /grammar/validate
     * Checks a grammar without registering it.
     */
    @PostMapping("/validate")
    public ResponseEntity<Boolean> validate(@RequestBody JsonNode grammar) {
        return ResponseEntity.ok(grammarService.validate(grammar));
    }

    /**
     * POST /grammar/{name}
     * Registers the grammar in the body; 400 if it is malformed or the name is taken.
     */
    @PostMapping("/{name}")
    public ResponseEntity<Void> register(@PathVariable String name, @RequestBody JsonNode grammar) {
        grammarService.register(name, grammar);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> remove(@PathVariable String name) {
        grammarService.remove(name);
        return ResponseEntity.noContent().build();
    }
}
