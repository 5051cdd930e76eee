package com.portablespreadsheet.app.models;

import com.portablespreadsheet.app.exceptions.AnchoringException;
import com.portablespreadsheet.app.exceptions.CellConstructionException;
import com.portablespreadsheet.app.exceptions.InvalidCellAttributeException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import com.portablespreadsheet.app.grammars.GrammarTable.AffixRule;
import com.portablespreadsheet.app.operations.Aggregate;
import com.portablespreadsheet.app.operations.CellValues;
import com.portablespreadsheet.app.operations.Operator;
import com.portablespreadsheet.app.words.Word;
import com.portablespreadsheet.app.words.WordConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - the anchor (row, column) in the grid, or none for intermediate results
 * - the value, computed when the cell is built
 * - the word: how the value was computed, in every notation
 * - the dependency node: which grid positions the value was computed from
 * - variable name, style and description
 *
 * Every operation returns a new unanchored cell and leaves its operands
 * untouched. Only the anchor, the style and the description ever change.
 */
public class Cell {
    private Integer row;
    private Integer column;
    private final Object value;
    private final CellType cellType;
    private final CellIndices cellIndices;
    // Word of a computational cell; built lazily from the value otherwise
    private Word constructingWord;
    private final DependencyNode dependencyNode;
    private final String variableName;
    private Map<String, Object> style = new LinkedHashMap<>();
    private String description;

    /**
     * A constant cell, anchored when row and column are given.
     */
    public Cell(Integer row, Integer column, Object value, CellIndices cellIndices) {
        this(row, column, finite(value), CellType.VALUE_ONLY, null, cellIndices, new DependencyNode(), null);
    }

    /**
     * An unanchored constant.
     */
    public Cell(Object value, CellIndices cellIndices) {
        this(null, null, value, cellIndices);
    }

    private Cell(Integer row, Integer column, Object value, CellType cellType, Word constructingWord,
                 CellIndices cellIndices, DependencyNode dependencyNode, String variableName) {
        if (cellIndices == null) {
            throw new CellConstructionException("Cell indices are required");
        }
        this.value = value;
        this.cellType = cellType;
        this.constructingWord = constructingWord;
        this.cellIndices = cellIndices;
        this.dependencyNode = dependencyNode;
        this.variableName = variableName;
        setAnchor(row, column);
    }

    /**
     * An unanchored variable holding a value.
     */
    public static Cell variableCell(String name, Object value, CellIndices cellIndices) {
        if (name == null || name.isBlank()) {
            throw new CellConstructionException("Variable name must not be blank");
        }
        return new Cell(null, null, finite(value), CellType.VALUE_ONLY, null, cellIndices, new DependencyNode(), name);
    }

    // Constants are written into every notation, which has no spelling for NaN or infinity
    private static Object finite(Object value) {
        if ((value instanceof Double && !Double.isFinite((Double) value))
                || (value instanceof Float && !Float.isFinite((Float) value))) {
            throw new CellConstructionException("Constant value must be finite, got " + value);
        }
        return value;
    }

    private static Cell computed(Object value, Word word, Cell source, DependencyNode node) {
        return new Cell(null, null, value, CellType.COMPUTATIONAL, word, source.cellIndices, node, null);
    }

    // Binary operations

    /**
     * Applies a binary operator: the value is computed from both operand
     * values, the word from both operand words.
     */
    public Cell apply(Operator operator, Cell other) {
        if (!operator.isBinary()) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
        Object result = operator.evaluate(this.value, other.value);
        return computed(result, WordConstructor.binary(operator, this, other), this,
                DependencyNode.construct(this, other));
    }

    public Cell add(Cell other) {
        return apply(Operator.ADD, other);
    }

    public Cell subtract(Cell other) {
        return apply(Operator.SUBTRACT, other);
    }

    public Cell multiply(Cell other) {
        return apply(Operator.MULTIPLY, other);
    }

    public Cell divide(Cell other) {
        return apply(Operator.DIVIDE, other);
    }

    public Cell modulo(Cell other) {
        return apply(Operator.MODULO, other);
    }

    public Cell power(Cell other) {
        return apply(Operator.POWER, other);
    }

    public Cell equalTo(Cell other) {
        return apply(Operator.EQUAL_TO, other);
    }

    public Cell notEqualTo(Cell other) {
        return apply(Operator.NOT_EQUAL_TO, other);
    }

    public Cell greaterThan(Cell other) {
        return apply(Operator.GREATER_THAN, other);
    }

    public Cell greaterThanOrEqualTo(Cell other) {
        return apply(Operator.GREATER_THAN_OR_EQUAL_TO, other);
    }

    public Cell lessThan(Cell other) {
        return apply(Operator.LESS_THAN, other);
    }

    public Cell lessThanOrEqualTo(Cell other) {
        return apply(Operator.LESS_THAN_OR_EQUAL_TO, other);
    }

    public Cell logicalConjunction(Cell other) {
        return apply(Operator.LOGICAL_CONJUNCTION, other);
    }

    public Cell logicalDisjunction(Cell other) {
        return apply(Operator.LOGICAL_DISJUNCTION, other);
    }

    public Cell concatenate(Cell other) {
        return apply(Operator.CONCATENATE, other);
    }

    // Unary operations

    /**
     * Applies a unary operator to the value and the word of the operand.
     */
    public static Cell applyUnary(Operator operator, Cell operand) {
        if (operator.isBinary()) {
            throw new IllegalArgumentException(operator + " is not a unary operator");
        }
        Object result = operator.evaluate(operand.value);
        return computed(result, WordConstructor.unary(operator, operand), operand,
                DependencyNode.construct(operand));
    }

    public static Cell logarithm(Cell cell) {
        return applyUnary(Operator.LOGARITHM, cell);
    }

    public static Cell exponential(Cell cell) {
        return applyUnary(Operator.EXPONENTIAL, cell);
    }

    public static Cell ceil(Cell cell) {
        return applyUnary(Operator.CEIL, cell);
    }

    public static Cell floor(Cell cell) {
        return applyUnary(Operator.FLOOR, cell);
    }

    public static Cell round(Cell cell) {
        return applyUnary(Operator.ROUND, cell);
    }

    public static Cell abs(Cell cell) {
        return applyUnary(Operator.ABS, cell);
    }

    public static Cell sqrt(Cell cell) {
        return applyUnary(Operator.SQRT, cell);
    }

    public static Cell signum(Cell cell) {
        return applyUnary(Operator.SIGNUM, cell);
    }

    public static Cell logicalNegation(Cell cell) {
        return applyUnary(Operator.LOGICAL_NEGATION, cell);
    }

    public static Cell brackets(Cell cell) {
        return applyUnary(Operator.BRACKETS, cell);
    }

    /**
     * Coordinates of an anchored cell, holding its value.
     *
     * @throws AnchoringException if the cell is not anchored
     */
    public static Cell reference(Cell cell) {
        requireAnchored(cell, "reference");
        return computed(cell.value, WordConstructor.reference(cell), cell, DependencyNode.construct(cell));
    }

    /**
     * Name of a variable cell, holding its value.
     *
     * @throws InvalidCellAttributeException if the cell is not a variable
     */
    public static Cell variable(Cell cell) {
        if (!cell.isVariable()) {
            throw new InvalidCellAttributeException("Cell is not a variable");
        }
        return computed(cell.value, WordConstructor.variable(cell), cell, DependencyNode.construct(cell));
    }

    // Aggregates

    /**
     * Reduces the values of the members; the word only names the range from
     * start to end.
     *
     * @throws AnchoringException if start or end is not anchored
     */
    public static Cell aggregate(Aggregate aggregate, Cell start, Cell end, Iterable<Cell> members) {
        requireAnchored(start, aggregate.getGrammarKey());
        requireAnchored(end, aggregate.getGrammarKey());
        List<Object> values = new ArrayList<>();
        List<Cell> operands = new ArrayList<>();
        operands.add(start);
        operands.add(end);
        for (Cell member : members) {
            values.add(member.value);
            if (member != start && member != end) {
                operands.add(member);
            }
        }
        Object result = aggregate.evaluate(values);
        return computed(result, WordConstructor.aggregation(aggregate, start, end), start,
                DependencyNode.construct(operands));
    }

    public static Cell sum(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.SUM, start, end, members);
    }

    public static Cell product(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.PRODUCT, start, end, members);
    }

    public static Cell mean(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.MEAN, start, end, members);
    }

    public static Cell minimum(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.MINIMUM, start, end, members);
    }

    public static Cell maximum(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.MAXIMUM, start, end, members);
    }

    public static Cell stdev(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.STDEV, start, end, members);
    }

    public static Cell median(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.MEDIAN, start, end, members);
    }

    public static Cell count(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.COUNT, start, end, members);
    }

    public static Cell irr(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.IRR, start, end, members);
    }

    public static Cell matchNegativeBeforePositive(Cell start, Cell end, Iterable<Cell> members) {
        return aggregate(Aggregate.MATCH_NEGATIVE_BEFORE_POSITIVE, start, end, members);
    }

    // Special forms

    /**
     * Takes the value of the consequent when the condition holds, of the
     * alternative otherwise. The word always holds all three branches.
     */
    public static Cell conditional(Cell condition, Cell consequent, Cell alternative) {
        Object result = CellValues.isTruthy(condition.value) ? consequent.value : alternative.value;
        return computed(result, WordConstructor.conditional(condition, consequent, alternative), condition,
                DependencyNode.construct(condition, consequent, alternative));
    }

    /**
     * The target value, written as the reference position shifted by the skips.
     *
     * @throws AnchoringException if the reference or the target is not anchored
     */
    public static Cell offset(Cell reference, Cell rowSkip, Cell columnSkip, Cell target) {
        requireAnchored(reference, "offset");
        requireAnchored(target, "offset");
        return computed(target.value, WordConstructor.offset(reference, rowSkip, columnSkip), reference,
                DependencyNode.construct(reference, rowSkip, columnSkip, target));
    }

    /**
     * The value of the other cell with words supplied by the caller.
     * Nothing checks that the words compute that value.
     */
    public static Cell raw(Cell other, Map<String, String> words) {
        return computed(other.value, WordConstructor.raw(other, words), other, DependencyNode.construct(other));
    }

    // Rendering

    /**
     * The word used when this cell is an operand: its coordinates when
     * anchored, otherwise its own expression or constant.
     */
    public Word getWord() {
        if (isAnchored()) {
            return WordConstructor.reference(this);
        }
        return getConstructingWord();
    }

    /**
     * How the value of this cell was computed, regardless of its anchor.
     */
    public Word getConstructingWord() {
        if (constructingWord == null) {
            constructingWord = WordConstructor.constant(this);
        }
        return constructingWord;
    }

    /**
     * Complete text of the cell in every registered notation. Computed cells
     * get the operation affixes of each notation.
     */
    public Map<String, String> parse() {
        Map<String, String> body = getConstructingWord().render(cellIndices);
        if (cellType == CellType.VALUE_ONLY) {
            return body;
        }
        GrammarRegistry grammars = cellIndices.getGrammars();
        Map<String, String> parsed = new LinkedHashMap<>();
        body.forEach((notation, text) -> {
            AffixRule rule = grammars.get(notation).getCells().getOperation();
            parsed.put(notation, rule.getPrefix() + text + rule.getSuffix());
        });
        return parsed;
    }

    // Grid support

    /**
     * A copy of this cell anchored at the given position, keeping its value,
     * kind and word.
     */
    Cell anchoredCopy(int row, int column) {
        DependencyNode node = dependencyNode.copy();
        Word word = isComputational() ? getConstructingWord() : null;
        Cell copy = new Cell(row, column, value, cellType, word, cellIndices, node, variableName);
        copy.style = new LinkedHashMap<>(style);
        copy.description = description;
        return copy;
    }

    void renumberAfterRowDeletion(int deletedRow) {
        if (constructingWord != null) {
            constructingWord = constructingWord.deleteRow(deletedRow);
        }
    }

    void renumberAfterColumnDeletion(int deletedColumn) {
        if (constructingWord != null) {
            constructingWord = constructingWord.deleteColumn(deletedColumn);
        }
    }

    // Attributes

    public Object getValue() {
        return value;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getColumn() {
        return column;
    }

    public Coordinates getCoordinates() {
        return isAnchored() ? new Coordinates(row, column) : null;
    }

    /**
     * Anchors the cell, moving its dependency node along with it.
     */
    public void setCoordinates(int row, int column) {
        setAnchor(row, column);
    }

    private void setAnchor(Integer row, Integer column) {
        // Validates first, so that the cell and its node never diverge
        dependencyNode.setCoordinates(row, column);
        this.row = row;
        this.column = column;
    }

    public boolean isAnchored() {
        return row != null;
    }

    public CellType getCellType() {
        return cellType;
    }

    public boolean isComputational() {
        return cellType == CellType.COMPUTATIONAL;
    }

    public CellIndices getCellIndices() {
        return cellIndices;
    }

    public DependencyNode getDependencyNode() {
        return dependencyNode;
    }

    public boolean isVariable() {
        return variableName != null;
    }

    public String getVariableName() {
        return variableName;
    }

    public Map<String, Object> getStyle() {
        return Collections.unmodifiableMap(style);
    }

    /**
     * @throws InvalidCellAttributeException unless every key is a non-blank
     *         string and every value a string, number or boolean
     */
    public void setStyle(Map<String, ?> style) {
        this.style = checkStyle(style);
    }

    /**
     * A copy of the style, if it is a valid one.
     *
     * @throws InvalidCellAttributeException otherwise
     */
    public static Map<String, Object> checkStyle(Map<?, ?> style) {
        if (style == null) {
            throw new InvalidCellAttributeException("Style must be a mapping");
        }
        Map<String, Object> checked = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : style.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new InvalidCellAttributeException("Style keys must be strings");
            }
            String key = (String) entry.getKey();
            if (key.isBlank()) {
                throw new InvalidCellAttributeException("Style keys must not be blank");
            }
            Object item = entry.getValue();
            if (!(item instanceof String || item instanceof Number || item instanceof Boolean)) {
                throw new InvalidCellAttributeException("Style " + key + " must be a string, number or boolean");
            }
            checked.put(key, item);
        }
        return checked;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    private static void requireAnchored(Cell cell, String operation) {
        if (!cell.isAnchored()) {
            throw new AnchoringException("Operation " + operation + " needs an anchored cell");
        }
    }

    @Override
    public String toString() {
        return "Cell" + (isAnchored() ? "(" + row + ", " + column + ")" : "") + "[" + value + "]";
    }
}
