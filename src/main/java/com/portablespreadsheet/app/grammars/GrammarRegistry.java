package com.portablespreadsheet.app.grammars;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portablespreadsheet.app.exceptions.GrammarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named notations every word is rendered to.
 *
 * Reads are lock free: the map is replaced as a whole on every change, so
 * a reader sees either the old or the new set of grammars, never a partial
 * registration.
 */
public class GrammarRegistry {

    private static final Logger log = LoggerFactory.getLogger(GrammarRegistry.class);

    public static final String REFERENCE_GRAMMAR = "python_numpy";
    public static final List<String> BUILT_IN_GRAMMARS = List.of("excel", REFERENCE_GRAMMAR, "native");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    private static volatile GrammarRegistry defaultRegistry;

    private final GrammarValidator validator;
    private volatile Map<String, Entry> grammars = Collections.emptyMap();

    public GrammarRegistry(JsonNode referenceShape) {
        this.validator = new GrammarValidator(referenceShape);
    }

    /**
     * A new registry holding the bundled grammars.
     */
    public static GrammarRegistry withBuiltInGrammars() {
        GrammarRegistry registry = new GrammarRegistry(loadBundled(REFERENCE_GRAMMAR));
        for (String name : BUILT_IN_GRAMMARS) {
            registry.register(loadBundled(name), name);
        }
        return registry;
    }

    /**
     * The registry shared by the whole process, created on first use.
     */
    public static GrammarRegistry getDefault() {
        GrammarRegistry registry = defaultRegistry;
        if (registry == null) {
            synchronized (GrammarRegistry.class) {
                registry = defaultRegistry;
                if (registry == null) {
                    registry = withBuiltInGrammars();
                    defaultRegistry = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Reads a grammar bundled under grammars/ on the classpath.
     */
    public static JsonNode loadBundled(String name) {
        return loadResource("grammars/" + name + ".json");
    }

    public static JsonNode loadResource(String path) {
        try (InputStream in = GrammarRegistry.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new GrammarException("Grammar resource not found: " + path);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new GrammarException("Cannot read grammar resource " + path, e);
        }
    }

    public boolean validate(JsonNode grammar) {
        return validator.isValid(grammar);
    }

    /**
     * Registers a grammar under a new notation name.
     *
     * @throws GrammarException if the name is blank or taken, or the grammar is malformed
     */
    public synchronized void register(JsonNode grammar, String name) {
        if (name == null || name.isBlank()) {
            throw new GrammarException("Notation name must not be blank");
        }
        if (grammars.containsKey(name)) {
            throw new GrammarException("Notation " + name + " is already registered");
        }
        validator.check(grammar);
        GrammarTable table;
        try {
            table = MAPPER.treeToValue(grammar, GrammarTable.class);
        } catch (JsonProcessingException e) {
            throw new GrammarException("Grammar " + name + " cannot be read: " + e.getOriginalMessage(), e);
        }
        Map<String, Entry> updated = new LinkedHashMap<>(grammars);
        updated.put(name, new Entry(grammar.deepCopy(), table));
        grammars = Collections.unmodifiableMap(updated);
        log.info("Registered notation {}", name);
    }

    /**
     * Registers a grammar given as nested maps, as read from YAML or built in code.
     */
    public void register(Map<String, ?> grammar, String name) {
        JsonNode tree = MAPPER.valueToTree(grammar);
        register(tree, name);
    }

    /**
     * @throws GrammarException if no notation of that name is registered
     */
    public synchronized void remove(String name) {
        if (!grammars.containsKey(name)) {
            throw new GrammarException("Notation " + name + " is not registered");
        }
        Map<String, Entry> updated = new LinkedHashMap<>(grammars);
        updated.remove(name);
        grammars = Collections.unmodifiableMap(updated);
        log.info("Removed notation {}", name);
    }

    public Set<String> listRegisteredNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(grammars.keySet()));
    }

    public boolean isRegistered(String name) {
        return grammars.containsKey(name);
    }

    public GrammarTable get(String name) {
        return entry(name).table;
    }

    /**
     * The grammar exactly as it was registered.
     */
    public JsonNode getSource(String name) {
        return entry(name).source.deepCopy();
    }

    private Entry entry(String name) {
        Entry entry = grammars.get(name);
        if (entry == null) {
            throw new GrammarException("Notation " + name + " is not registered");
        }
        return entry;
    }

    private static final class Entry {
        private final JsonNode source;
        private final GrammarTable table;

        private Entry(JsonNode source, GrammarTable table) {
            this.source = source;
            this.table = table;
        }
    }
}
