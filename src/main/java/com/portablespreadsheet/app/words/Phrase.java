package com.portablespreadsheet.app.words;

import com.portablespreadsheet.app.models.CellIndices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The rendering of a word in one notation.
 *
 * Row and column labels are kept as positions and resolved against the
 * {@link CellIndices} only when the phrase is rendered, so that deleting a
 * row or a column can renumber them. Phrases are immutable.
 */
public final class Phrase {

    private static final Phrase EMPTY = new Phrase(Collections.emptyList());

    private final List<Token> tokens;

    private Phrase(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Phrase empty() {
        return EMPTY;
    }

    public static Phrase text(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return new Phrase(List.of(new Token(TokenKind.TEXT, text, 0)));
    }

    public static Phrase rowLabel(int row) {
        return new Phrase(List.of(new Token(TokenKind.ROW_LABEL, null, row)));
    }

    public static Phrase columnLabel(int column) {
        return new Phrase(List.of(new Token(TokenKind.COLUMN_LABEL, null, column)));
    }

    public Phrase append(String text) {
        return append(text(text));
    }

    public Phrase append(Phrase other) {
        if (other.tokens.isEmpty()) {
            return this;
        }
        if (tokens.isEmpty()) {
            return other;
        }
        List<Token> joined = new ArrayList<>(tokens.size() + other.tokens.size());
        joined.addAll(tokens);
        for (Token token : other.tokens) {
            int last = joined.size() - 1;
            if (token.kind == TokenKind.TEXT && joined.get(last).kind == TokenKind.TEXT) {
                joined.set(last, new Token(TokenKind.TEXT, joined.get(last).text + token.text, 0));
            } else {
                joined.add(token);
            }
        }
        return new Phrase(Collections.unmodifiableList(joined));
    }

    public Phrase wrap(String prefix, String suffix) {
        return text(prefix).append(this).append(suffix);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * Renders the labels in the given notation.
     */
    public String render(String notation, CellIndices indices) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            switch (token.kind) {
                case ROW_LABEL:
                    out.append(indices.rowLabel(notation, token.position));
                    break;
                case COLUMN_LABEL:
                    out.append(indices.columnLabel(notation, token.position));
                    break;
                default:
                    out.append(token.text);
            }
        }
        return out.toString();
    }

    /**
     * Moves the row labels past a deleted row one position up.
     */
    public Phrase deleteRow(int row) {
        return shift(TokenKind.ROW_LABEL, row);
    }

    public Phrase deleteColumn(int column) {
        return shift(TokenKind.COLUMN_LABEL, column);
    }

    private Phrase shift(TokenKind kind, int deleted) {
        List<Token> shifted = new ArrayList<>(tokens.size());
        boolean changed = false;
        for (Token token : tokens) {
            if (token.kind == kind && token.position > deleted) {
                shifted.add(new Token(kind, null, token.position - 1));
                changed = true;
            } else {
                shifted.add(token);
            }
        }
        return changed ? new Phrase(Collections.unmodifiableList(shifted)) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Phrase)) {
            return false;
        }
        return tokens.equals(((Phrase) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            out.append(token);
        }
        return out.toString();
    }

    private enum TokenKind {
        TEXT,
        ROW_LABEL,
        COLUMN_LABEL
    }

    private static final class Token {
        private final TokenKind kind;
        private final String text;
        private final int position;

        private Token(TokenKind kind, String text, int position) {
            this.kind = kind;
            this.text = text;
            this.position = position;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Token)) {
                return false;
            }
            Token other = (Token) o;
            return kind == other.kind && position == other.position && Objects.equals(text, other.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, text, position);
        }

        @Override
        public String toString() {
            switch (kind) {
                case ROW_LABEL:
                    return "{row " + position + "}";
                case COLUMN_LABEL:
                    return "{column " + position + "}";
                default:
                    return text;
            }
        }
    }
}
