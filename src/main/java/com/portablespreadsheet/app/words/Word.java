package com.portablespreadsheet.app.words;

import com.portablespreadsheet.app.exceptions.GrammarException;
import com.portablespreadsheet.app.models.CellIndices;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The expression of a cell written in every notation it was built for.
 * Immutable.
 */
public final class Word {

    private final Map<String, Phrase> phrases;

    public Word(Map<String, Phrase> phrases) {
        this.phrases = Collections.unmodifiableMap(new LinkedHashMap<>(phrases));
    }

    public Set<String> getNotations() {
        return phrases.keySet();
    }

    public boolean isDefinedFor(String notation) {
        return phrases.containsKey(notation);
    }

    public Phrase get(String notation) {
        Phrase phrase = phrases.get(notation);
        if (phrase == null) {
            throw new GrammarException("Word is not defined for notation " + notation);
        }
        return phrase;
    }

    /**
     * Renders every notation that is still registered in the indices' registry.
     */
    public Map<String, String> render(CellIndices indices) {
        Map<String, String> rendered = new LinkedHashMap<>();
        for (String notation : indices.getGrammars().listRegisteredNames()) {
            Phrase phrase = phrases.get(notation);
            if (phrase != null) {
                rendered.put(notation, phrase.render(notation, indices));
            }
        }
        return rendered;
    }

    public Word deleteRow(int row) {
        Map<String, Phrase> shifted = new LinkedHashMap<>();
        phrases.forEach((notation, phrase) -> shifted.put(notation, phrase.deleteRow(row)));
        return new Word(shifted);
    }

    public Word deleteColumn(int column) {
        Map<String, Phrase> shifted = new LinkedHashMap<>();
        phrases.forEach((notation, phrase) -> shifted.put(notation, phrase.deleteColumn(column)));
        return new Word(shifted);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Word && phrases.equals(((Word) o).phrases);
    }

    @Override
    public int hashCode() {
        return phrases.hashCode();
    }

    @Override
    public String toString() {
        return phrases.toString();
    }
}
