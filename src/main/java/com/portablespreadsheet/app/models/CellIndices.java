package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.CellConstructionException;
import com.portablespreadsheet.app.exceptions.CellNotFoundException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Row and column labels of a grid in every notation.
 *
 * Each axis has one label more than it has positions, so that a range
 * ending on the last row or column can be rendered with an exclusive end.
 * Labels are generated on request; only the custom labels of the "native"
 * notation are stored.
 */
public class CellIndices {

    private static final Logger log = LoggerFactory.getLogger(CellIndices.class);

    public static final String EXCEL = "excel";
    public static final String NATIVE = "native";

    private final GrammarRegistry grammars;
    private final boolean excelLabelOffset;
    private int numberOfRows;
    private int numberOfColumns;
    private final List<String> rowLabels;
    private final List<String> columnLabels;

    public CellIndices(int numberOfRows, int numberOfColumns) {
        this(numberOfRows, numberOfColumns, GrammarRegistry.getDefault());
    }

    public CellIndices(int numberOfRows, int numberOfColumns, GrammarRegistry grammars) {
        this(builder(numberOfRows, numberOfColumns).grammars(grammars));
    }

    private CellIndices(Builder builder) {
        if (builder.numberOfRows < 0 || builder.numberOfColumns < 0) {
            throw new CellConstructionException("Grid dimensions must not be negative");
        }
        this.grammars = builder.grammars != null ? builder.grammars : GrammarRegistry.getDefault();
        this.excelLabelOffset = builder.excelLabelOffset;
        this.numberOfRows = builder.numberOfRows;
        this.numberOfColumns = builder.numberOfColumns;
        this.rowLabels = customLabels(builder.rowLabels, numberOfRows, "row");
        this.columnLabels = customLabels(builder.columnLabels, numberOfColumns, "column");
    }

    public static Builder builder(int numberOfRows, int numberOfColumns) {
        return new Builder(numberOfRows, numberOfColumns);
    }

    public GrammarRegistry getGrammars() {
        return grammars;
    }

    public int getNumberOfRows() {
        return numberOfRows;
    }

    public int getNumberOfColumns() {
        return numberOfColumns;
    }

    public boolean isExcelLabelOffset() {
        return excelLabelOffset;
    }

    public String rowLabel(String notation, int row) {
        checkPosition(row, numberOfRows, "Row");
        if (EXCEL.equals(notation)) {
            return String.valueOf(row + 1 + offset());
        }
        if (NATIVE.equals(notation)) {
            return row < rowLabels.size() ? rowLabels.get(row) : String.valueOf(row + 1);
        }
        return String.valueOf(row);
    }

    public String columnLabel(String notation, int column) {
        checkPosition(column, numberOfColumns, "Column");
        if (EXCEL.equals(notation)) {
            return excelColumn(column + offset());
        }
        if (NATIVE.equals(notation)) {
            return column < columnLabels.size() ? columnLabels.get(column) : String.valueOf(column + 1);
        }
        return String.valueOf(column);
    }

    /**
     * All row labels of a notation, including the trailing one.
     */
    public List<String> getRowLabels(String notation) {
        List<String> labels = new ArrayList<>(numberOfRows + 1);
        for (int row = 0; row <= numberOfRows; row++) {
            labels.add(rowLabel(notation, row));
        }
        return labels;
    }

    public List<String> getColumnLabels(String notation) {
        List<String> labels = new ArrayList<>(numberOfColumns + 1);
        for (int column = 0; column <= numberOfColumns; column++) {
            labels.add(columnLabel(notation, column));
        }
        return labels;
    }

    void deleteRow(int row) {
        if (row < rowLabels.size()) {
            rowLabels.remove(row);
        }
        numberOfRows--;
    }

    void deleteColumn(int column) {
        if (column < columnLabels.size()) {
            columnLabels.remove(column);
        }
        numberOfColumns--;
    }

    /**
     * Excel name of a column position: A, B, ..., Z, AA, AB, ...
     */
    static String excelColumn(int column) {
        StringBuilder name = new StringBuilder();
        int remaining = column + 1;
        while (remaining > 0) {
            int letter = (remaining - 1) % 26;
            name.insert(0, (char) ('A' + letter));
            remaining = (remaining - 1) / 26;
        }
        return name.toString();
    }

    // Excel keeps the first row and column for headers
    private int offset() {
        return excelLabelOffset ? 1 : 0;
    }

    private static void checkPosition(int position, int size, String axis) {
        if (position < 0 || position > size) {
            throw new CellNotFoundException(axis + " " + position + " is outside the grid");
        }
    }

    private static List<String> customLabels(List<String> labels, int size, String axis) {
        if (labels == null) {
            return new ArrayList<>();
        }
        if (labels.size() != size) {
            throw new CellConstructionException("Expected " + size + " " + axis + " labels, got " + labels.size());
        }
        Set<String> seen = new HashSet<>();
        for (String label : labels) {
            if (!seen.add(label)) {
                log.warn("Duplicate {} label '{}'", axis, label);
            }
        }
        return new ArrayList<>(labels);
    }

    public static class Builder {
        private final int numberOfRows;
        private final int numberOfColumns;
        private GrammarRegistry grammars;
        private boolean excelLabelOffset = true;
        private List<String> rowLabels;
        private List<String> columnLabels;

        private Builder(int numberOfRows, int numberOfColumns) {
            this.numberOfRows = numberOfRows;
            this.numberOfColumns = numberOfColumns;
        }

        public Builder grammars(GrammarRegistry grammars) {
            this.grammars = grammars;
            return this;
        }

        public Builder excelLabelOffset(boolean excelLabelOffset) {
            this.excelLabelOffset = excelLabelOffset;
            return this;
        }

        public Builder rowLabels(List<String> rowLabels) {
            this.rowLabels = rowLabels;
            return this;
        }

        public Builder columnLabels(List<String> columnLabels) {
            this.columnLabels = columnLabels;
            return this;
        }

        public CellIndices build() {
            return new CellIndices(this);
        }
    }
}
