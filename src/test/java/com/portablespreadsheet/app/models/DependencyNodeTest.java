package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.CellConstructionException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deletion and renumbering in dependency trees.
 *
 * The tree used by most tests:
 * (0,0) -> [(1,0) -> [(3,2) -> [(7,2), (8,2), (9,2), (10,2)]], (0,1) -> [(7,8), (9,10)]]
 */
class DependencyNodeTest {

    private DependencyNode tree;

    @BeforeEach
    void setUp() {
        DependencyNode c = new DependencyNode(3, 2);
        c.addChild(new DependencyNode(7, 2));
        c.addChild(new DependencyNode(8, 2));
        c.addChild(new DependencyNode(9, 2));
        c.addChild(new DependencyNode(10, 2));
        DependencyNode a = new DependencyNode(1, 0);
        a.addChild(c);
        DependencyNode b = new DependencyNode(0, 1);
        b.addChild(new DependencyNode(7, 8));
        b.addChild(new DependencyNode(9, 10));

        tree = new DependencyNode(0, 0);
        tree.addChild(a);
        tree.addChild(b);
    }

    @Test
    void testDeleteLeaf() {
        List<Coordinates> touched = tree.delete(9, 2);

        assertEquals(List.of(new Coordinates(3, 2), new Coordinates(1, 0), new Coordinates(0, 0)), touched);
        DependencyNode c = tree.getChildren().get(0).getChildren().get(0);
        assertEquals(List.of(new Coordinates(7, 2), new Coordinates(8, 2), new Coordinates(10, 2)), positions(c));
    }

    /**
     * Deleting an inner node removes its whole subtree; the node itself is
     * not part of the returned positions.
     */
    @Test
    void testDeleteInnerNode() {
        List<Coordinates> touched = tree.delete(3, 2);

        assertEquals(List.of(new Coordinates(1, 0), new Coordinates(0, 0)), touched);
        assertTrue(tree.getChildren().get(0).getChildren().isEmpty());
        assertEquals(2, tree.getChildren().get(1).getChildren().size());
    }

    @Test
    void testDeleteMissingPosition() {
        assertTrue(tree.delete(4, 4).isEmpty());
        assertEquals(2, tree.getChildren().size());
    }

    @Test
    void testDeleteRow() {
        List<Coordinates> touched = tree.deleteRow(1);

        assertEquals(List.of(new Coordinates(0, 0)), touched);
        assertEquals(List.of(new Coordinates(0, 1)), positions(tree));
        DependencyNode b = tree.getChildren().get(0);
        assertEquals(List.of(new Coordinates(6, 8), new Coordinates(8, 10)), positions(b));
    }

    @Test
    void testDeleteColumn() {
        List<Coordinates> touched = tree.deleteColumn(1);

        assertEquals(List.of(new Coordinates(0, 0)), touched);
        assertEquals(List.of(new Coordinates(1, 0)), positions(tree));
        DependencyNode c = tree.getChildren().get(0).getChildren().get(0);
        assertEquals(new Coordinates(3, 1), new Coordinates(c.getRow(), c.getColumn()));
        assertEquals(List.of(new Coordinates(7, 1), new Coordinates(8, 1), new Coordinates(9, 1),
                new Coordinates(10, 1)), positions(c));
    }

    /**
     * Rows above the deleted one stay, rows below move up by one.
     */
    @Test
    void testDeleteRowRenumbers() {
        DependencyNode root = new DependencyNode();
        for (int row : new int[]{0, 1, 3, 3, 5}) {
            root.addChild(new DependencyNode(row, 0));
        }

        root.deleteRow(1);

        List<Integer> rows = new ArrayList<>();
        for (DependencyNode child : root.getChildren()) {
            rows.add(child.getRow());
        }
        assertEquals(List.of(0, 2, 2, 4), rows);
    }

    @Test
    void testComputationalNodesAreNotReported() {
        DependencyNode root = new DependencyNode();
        root.addChild(new DependencyNode(2, 2));

        assertTrue(root.deleteRow(2).isEmpty());
        assertTrue(root.getChildren().isEmpty());
    }

    @Test
    void testRowAndColumnGoTogether() {
        assertThrows(CellConstructionException.class, () -> new DependencyNode(1, null));
        assertThrows(CellConstructionException.class, () -> new DependencyNode(null, 1));
        assertThrows(CellConstructionException.class, () -> new DependencyNode(-1, 0));
        assertFalse(new DependencyNode().hasPosition());
    }

    @Test
    void testChildrenAreCopies() {
        DependencyNode child = new DependencyNode(4, 4);
        DependencyNode parent = new DependencyNode();
        parent.addChild(child);

        child.addChild(new DependencyNode(1, 1));
        child.deleteRow(0);

        DependencyNode grafted = parent.getChildren().get(0);
        assertEquals(4, grafted.getRow());
        assertTrue(grafted.getChildren().isEmpty());
    }

    @Test
    void testCopyIsDeep() {
        DependencyNode copy = tree.copy();

        copy.deleteRow(1);

        assertEquals(List.of(new Coordinates(1, 0), new Coordinates(0, 1)), positions(tree));
        assertEquals(List.of(new Coordinates(0, 1)), positions(copy));
    }

    @Test
    void testConstructFromCells() {
        CellIndices indices = new CellIndices(5, 5, GrammarRegistry.withBuiltInGrammars());
        Cell anchored = new Cell(2, 3, 1, indices);
        Cell loose = new Cell(1, indices);

        DependencyNode node = DependencyNode.construct(anchored, loose);

        assertFalse(node.hasPosition());
        assertEquals(2, node.getChildren().size());
        assertEquals(new Coordinates(2, 3), positions(node).get(0));
        assertFalse(node.getChildren().get(1).hasPosition());
    }

    private static List<Coordinates> positions(DependencyNode node) {
        List<Coordinates> positions = new ArrayList<>();
        for (DependencyNode child : node.getChildren()) {
            if (child.hasPosition()) {
                positions.add(new Coordinates(child.getRow(), child.getColumn()));
            }
        }
        return positions;
    }
}
