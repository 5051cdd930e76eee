package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.CellNotFoundException;
import com.portablespreadsheet.app.exceptions.DependentCellException;
import com.portablespreadsheet.app.exceptions.VariableNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - A grid of anchored cells, created bare (no value)
 * - Named variables
 * - A read/write lock for concurrency
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final CellIndices cellIndices;
    private final List<List<Cell>> cells = new ArrayList<>();
    private final Map<String, Cell> variables = new LinkedHashMap<>();

    // Lock to prevent race conditions when multiple threads update the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(CellIndices cellIndices) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.cellIndices = cellIndices;
        for (int row = 0; row < cellIndices.getNumberOfRows(); row++) {
            List<Cell> line = new ArrayList<>();
            for (int column = 0; column < cellIndices.getNumberOfColumns(); column++) {
                line.add(new Cell(row, column, null, cellIndices));
            }
            cells.add(line);
        }
    }

    public long getId() {
        return id;
    }

    public CellIndices getCellIndices() {
        return cellIndices;
    }

    public int getNumberOfRows() {
        return cells.size();
    }

    public int getNumberOfColumns() {
        return cellIndices.getNumberOfColumns();
    }

    public Cell getCell(int row, int column) {
        checkCell(row, column);
        return cells.get(row).get(column);
    }

    /**
     * Anchors a copy of the cell at the given position.
     *
     * @return the anchored copy now held by the sheet
     */
    public Cell setCell(int row, int column, Cell cell) {
        checkCell(row, column);
        Cell anchored = cell.anchoredCopy(row, column);
        cells.get(row).set(column, anchored);
        return anchored;
    }

    /**
     * Cells of the range between both corners (inclusive), row by row.
     */
    public List<Cell> slice(int startRow, int startColumn, int endRow, int endColumn) {
        checkCell(startRow, startColumn);
        checkCell(endRow, endColumn);
        List<Cell> members = new ArrayList<>();
        for (int row = Math.min(startRow, endRow); row <= Math.max(startRow, endRow); row++) {
            for (int column = Math.min(startColumn, endColumn); column <= Math.max(startColumn, endColumn); column++) {
                members.add(cells.get(row).get(column));
            }
        }
        return members;
    }

    /**
     * Defines a variable, replacing any variable of the same name.
     */
    public Cell defineVariable(String name, Object value, String description) {
        Cell variable = Cell.variableCell(name, value, cellIndices);
        variable.setDescription(description);
        variables.put(name, variable);
        return variable;
    }

    public Cell getVariable(String name) {
        Cell variable = variables.get(name);
        if (variable == null) {
            throw new VariableNotFoundException("Variable " + name + " is not defined");
        }
        return variable;
    }

    public Map<String, Cell> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    /**
     * Removes a row and moves the rows below it one up.
     *
     * @throws DependentCellException if a remaining cell was computed from the row;
     *         the sheet is left unchanged
     */
    public void deleteRow(int row) {
        checkCell(row, 0);
        for (List<Cell> line : cells) {
            for (Cell cell : line) {
                if (cell.getRow() != row && !cell.getDependencyNode().copy().deleteRow(row).isEmpty()) {
                    throw new DependentCellException("Cannot delete row " + row + ": cell "
                            + cell.getCoordinates() + " is computed from it");
                }
            }
        }
        cells.remove(row);
        for (List<Cell> line : cells) {
            for (Cell cell : line) {
                cell.getDependencyNode().deleteRow(row);
                if (cell.getRow() > row) {
                    cell.setCoordinates(cell.getRow() - 1, cell.getColumn());
                }
                cell.renumberAfterRowDeletion(row);
            }
        }
        cellIndices.deleteRow(row);
    }

    /**
     * Removes a column and moves the columns right of it one to the left.
     *
     * @throws DependentCellException if a remaining cell was computed from the column;
     *         the sheet is left unchanged
     */
    public void deleteColumn(int column) {
        checkCell(0, column);
        for (List<Cell> line : cells) {
            for (Cell cell : line) {
                if (cell.getColumn() != column && !cell.getDependencyNode().copy().deleteColumn(column).isEmpty()) {
                    throw new DependentCellException("Cannot delete column " + column + ": cell "
                            + cell.getCoordinates() + " is computed from it");
                }
            }
        }
        for (List<Cell> line : cells) {
            line.remove(column);
            for (Cell cell : line) {
                cell.getDependencyNode().deleteColumn(column);
                if (cell.getColumn() > column) {
                    cell.setCoordinates(cell.getRow(), cell.getColumn() - 1);
                }
                cell.renumberAfterColumnDeletion(column);
            }
        }
        cellIndices.deleteColumn(column);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    private void checkCell(int row, int column) {
        if (row < 0 || row >= getNumberOfRows() || column < 0 || column >= getNumberOfColumns()) {
            throw new CellNotFoundException("Cell (" + row + ", " + column + ") is outside the sheet");
        }
    }
}
