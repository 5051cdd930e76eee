package com.portablespreadsheet.app.models;

import java.util.List;

/**
 * Dimensions of a new sheet, with optional custom labels
 * used by the "native" notation.
 */
public class SheetRequest {
    private int rows;
    private int columns;
    private List<String> rowLabels;
    private List<String> columnLabels;

    // Default constructor needed for JSON (de)serialization
    public SheetRequest() {
    }

    public SheetRequest(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }
    public int getColumns() {
        return columns;
    }
    public List<String> getRowLabels() {
        return rowLabels;
    }
    public List<String> getColumnLabels() {
        return columnLabels;
    }
    public void setRows(int rows) {
        this.rows = rows;
    }
    public void setColumns(int columns) {
        this.columns = columns;
    }
    public void setRowLabels(List<String> rowLabels) {
        this.rowLabels = rowLabels;
    }
    public void setColumnLabels(List<String> columnLabels) {
        this.columnLabels = columnLabels;
    }
}
