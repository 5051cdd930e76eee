package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.CellConstructionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Records which grid positions a cell was built from.
 *
 * A node either has a position (row and column both set) or is purely
 * computational (both absent). Children are copies of the operands'
 * nodes taken when the cell was built, so later changes to an operand's
 * node never reach nodes built from it.
 */
public class DependencyNode {

    private Integer row;
    private Integer column;
    private final List<DependencyNode> children = new ArrayList<>();

    /**
     * A node without position.
     */
    public DependencyNode() {
    }

    public DependencyNode(Integer row, Integer column) {
        setCoordinates(row, column);
    }

    /**
     * A computational node whose children are copies of the cells' nodes.
     */
    public static DependencyNode construct(Cell... cells) {
        DependencyNode node = new DependencyNode();
        for (Cell cell : cells) {
            node.addChild(cell.getDependencyNode());
        }
        return node;
    }

    public static DependencyNode construct(List<Cell> cells) {
        return construct(cells.toArray(new Cell[0]));
    }

    /**
     * Grafts a copy of the given node.
     */
    public void addChild(DependencyNode child) {
        children.add(child.copy());
    }

    public DependencyNode copy() {
        DependencyNode copy = new DependencyNode();
        copy.row = row;
        copy.column = column;
        for (DependencyNode child : children) {
            copy.children.add(child.copy());
        }
        return copy;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return row != null;
    }

    void setCoordinates(Integer row, Integer column) {
        if ((row == null) != (column == null)) {
            throw new CellConstructionException("Both row and column must be set, or neither");
        }
        if (row != null && (row < 0 || column < 0)) {
            throw new CellConstructionException("Coordinates must not be negative: (" + row + ", " + column + ")");
        }
        this.row = row;
        this.column = column;
    }

    public List<DependencyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Deletes the nodes at the given position.
     *
     * @return positions of the remaining nodes that had a deleted node below them,
     *         children before parents
     */
    public List<Coordinates> delete(int row, int column) {
        return delete((Integer) row, (Integer) column);
    }

    /**
     * Deletes the nodes on the given row and moves the nodes below it one row up.
     *
     * @return positions (after renumbering) of the remaining nodes that had a
     *         deleted node below them, children before parents
     */
    public List<Coordinates> deleteRow(int row) {
        return delete(row, null);
    }

    public List<Coordinates> deleteColumn(int column) {
        return delete(null, column);
    }

    // An absent axis matches every position on it
    private List<Coordinates> delete(Integer row, Integer column) {
        List<Coordinates> touched = new ArrayList<>();
        delete(row, column, touched);
        return touched;
    }

    private boolean delete(Integer deletedRow, Integer deletedColumn, List<Coordinates> touched) {
        boolean deleted = matches(deletedRow, deletedColumn);
        boolean changed = deleted;
        Iterator<DependencyNode> it = children.iterator();
        while (it.hasNext()) {
            DependencyNode child = it.next();
            // Matched before the child renumbers itself
            boolean childDeleted = child.matches(deletedRow, deletedColumn);
            if (child.delete(deletedRow, deletedColumn, touched)) {
                changed = true;
            }
            if (childDeleted) {
                it.remove();
            }
        }
        if (!deleted && hasPosition()) {
            if (deletedColumn == null && row > deletedRow) {
                row--;
            }
            if (deletedRow == null && column > deletedColumn) {
                column--;
            }
            if (changed) {
                touched.add(new Coordinates(row, column));
            }
        }
        return changed;
    }

    private boolean matches(Integer deletedRow, Integer deletedColumn) {
        if (!hasPosition()) {
            return false;
        }
        return (deletedRow == null || row.equals(deletedRow))
                && (deletedColumn == null || column.equals(deletedColumn));
    }

    @Override
    public String toString() {
        String position = hasPosition() ? "(" + row + ", " + column + ")" : "(computation)";
        return children.isEmpty() ? position : position + children;
    }
}
