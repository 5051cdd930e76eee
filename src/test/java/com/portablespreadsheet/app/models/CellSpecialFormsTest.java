package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.AnchoringException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conditional, offset and raw cells.
 */
class CellSpecialFormsTest {

    private CellIndices indices;

    @BeforeEach
    void setUp() {
        indices = new CellIndices(5, 7, GrammarRegistry.withBuiltInGrammars());
    }

    /**
     * The value follows the taken branch, the word holds all three.
     */
    @Test
    void testConditional() {
        Cell x = new Cell(1, 3, 7, indices);
        Cell consequent = new Cell(2, 3, 11, indices);
        Cell condition = x.equalTo(new Cell(7, indices));

        Cell result = Cell.conditional(condition, consequent, new Cell(5, indices));

        assertEquals(11, result.getValue());
        assertEquals("=IF(E3=7,E4,5)", result.parse().get("excel"));
        assertEquals("((values[2,3]) if (values[1,3]==7) else (5))", result.parse().get("python_numpy"));
        assertEquals("if value at (2, 4) is equal to 7 then value at (3, 4) otherwise 5",
                result.parse().get("native"));
    }

    @Test
    void testConditionalTakesAlternative() {
        Cell condition = new Cell(0, indices);
        Cell result = Cell.conditional(condition, new Cell(1, indices), new Cell(2, indices));
        assertEquals(2, result.getValue());
    }

    @Test
    void testOffset() {
        Cell reference = new Cell(1, 3, 0, indices);
        Cell columnSkip = new Cell(2, 3, 1, indices);
        Cell target = new Cell(3, 4, 42, indices);

        Cell result = Cell.offset(reference, new Cell(7, indices), columnSkip, target);

        assertEquals(42, result.getValue());
        assertEquals("=OFFSET(E3,7,E4)", result.parse().get("excel"));
        assertEquals("values[int(1+7),int(3+values[2,3])]", result.parse().get("python_numpy"));
    }

    @Test
    void testOffsetNeedsAnchoredCells() {
        Cell reference = new Cell(1, 3, 0, indices);
        Cell skip = new Cell(1, indices);
        assertThrows(AnchoringException.class, () -> Cell.offset(skip, skip, skip, reference));
        assertThrows(AnchoringException.class, () -> Cell.offset(reference, skip, skip, skip));
    }

    /**
     * Raw words are taken verbatim and still marked as a computation.
     */
    @Test
    void testRaw() {
        Cell source = new Cell(3, 4, 7, indices);

        Cell result = Cell.raw(source, Map.of("excel", "Excel welcomes", "python_numpy", "Python welcomes"));

        assertEquals(7, result.getValue());
        assertEquals("=Excel welcomes", result.parse().get("excel"));
        assertEquals("Python welcomes", result.parse().get("python_numpy"));
        assertFalse(result.parse().containsKey("native"));
    }
}
