package com.portablespreadsheet.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * What a client sees of a cell: its value and its text in every notation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final Object value;
    private final CellType type;
    private final Map<String, String> words;
    private final String description;
    private final Map<String, Object> style;

    @JsonCreator
    public CellView(@JsonProperty("value") Object value,
                    @JsonProperty("type") CellType type,
                    @JsonProperty("words") Map<String, String> words,
                    @JsonProperty("description") String description,
                    @JsonProperty("style") Map<String, Object> style) {
        this.value = value;
        this.type = type;
        this.words = words;
        this.description = description;
        this.style = style;
    }

    public static CellView of(Cell cell) {
        return new CellView(cell.getValue(), cell.getCellType(), cell.parse(),
                cell.getDescription(), cell.getStyle().isEmpty() ? null : cell.getStyle());
    }

    public Object getValue() {
        return value;
    }

    public CellType getType() {
        return type;
    }

    public Map<String, String> getWords() {
        return words;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getStyle() {
        return style;
    }
}
