package com.portablespreadsheet.app.grammars;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portablespreadsheet.app.exceptions.GrammarException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatting rules of one notation (like "excel" or "python_numpy").
 * A PREFIX is inserted before a word, a SUFFIX after it and a SEPARATOR
 * between two words. A CONTENT replaces the word entirely.
 *
 * Instances are bound from JSON by {@link GrammarRegistry} only after the
 * JSON passed {@link GrammarValidator}, so every rule here is present.
 */
public class GrammarTable {

    private LabelRule rows;
    private LabelRule cols;
    private CellRules cells;
    private Map<String, AffixRule> operations = new LinkedHashMap<>();
    private ConditionalRule conditional;

    public LabelRule getRows() {
        return rows;
    }

    public LabelRule getCols() {
        return cols;
    }

    public CellRules getCells() {
        return cells;
    }

    public Map<String, AffixRule> getOperations() {
        return operations;
    }

    public ConditionalRule getConditional() {
        return conditional;
    }

    /**
     * Rule of the operator with the given grammar key (like "add" or "sum").
     */
    public AffixRule operation(String name) {
        AffixRule rule = operations.get(name);
        if (rule == null) {
            throw new GrammarException("Grammar does not define operation " + name);
        }
        return rule;
    }

    /**
     * Naming of rows or columns. Descriptive metadata only.
     */
    public static class LabelRule {
        private String nameRegexp;
        private int maximalNumber;

        public String getNameRegexp() {
            return nameRegexp;
        }

        public int getMaximalNumber() {
            return maximalNumber;
        }
    }

    /**
     * Text placed around a word, and between two words for binary operators.
     */
    public static class AffixRule {
        private String prefix = "";
        private String suffix = "";
        private String separator = "";

        public String getPrefix() {
            return prefix;
        }

        public String getSuffix() {
            return suffix;
        }

        public String getSeparator() {
            return separator;
        }
    }

    public static class EmptyRule {
        private String content = "";

        public String getContent() {
            return content;
        }
    }

    public static class BooleanRule {
        private String trueValue;
        private String falseValue;

        public String getTrueValue() {
            return trueValue;
        }

        public String getFalseValue() {
            return falseValue;
        }

        public String render(boolean value) {
            return value ? trueValue : falseValue;
        }
    }

    public static class ReferenceRule extends AffixRule {
        // If true, the row is on the first position (false for Excel)
        private boolean rowFirst;

        public boolean isRowFirst() {
            return rowFirst;
        }
    }

    /**
     * One endpoint of a range. With rowsOnly (colsOnly) the endpoint renders
     * the row (column) span of the whole range instead of its own position.
     */
    public static class EndpointRule extends ReferenceRule {
        private boolean rowsOnly;
        private boolean colsOnly;

        public boolean isRowsOnly() {
            return rowsOnly;
        }

        public boolean isColsOnly() {
            return colsOnly;
        }
    }

    public static class AggregationRule extends AffixRule {
        // Array slicing ends one position past the last cell
        private boolean endExclusive;
        private EndpointRule startCell;
        private EndpointRule endCell;

        public boolean isEndExclusive() {
            return endExclusive;
        }

        public EndpointRule getStartCell() {
            return startCell;
        }

        public EndpointRule getEndCell() {
            return endCell;
        }
    }

    public enum OffsetClause {
        @JsonProperty("referenceRow") REFERENCE_ROW,
        @JsonProperty("referenceColumn") REFERENCE_COLUMN,
        @JsonProperty("skipRows") SKIP_ROWS,
        @JsonProperty("skipColumns") SKIP_COLUMNS
    }

    public static class OffsetRule extends AffixRule {
        private List<OffsetClause> order = new ArrayList<>();
        private AffixRule referenceRow;
        private AffixRule referenceColumn;
        private AffixRule skipRows;
        private AffixRule skipColumns;

        public List<OffsetClause> getOrder() {
            return order;
        }

        public AffixRule clause(OffsetClause clause) {
            switch (clause) {
                case REFERENCE_ROW:
                    return referenceRow;
                case REFERENCE_COLUMN:
                    return referenceColumn;
                case SKIP_ROWS:
                    return skipRows;
                default:
                    return skipColumns;
            }
        }
    }

    /**
     * Wrapping of the operands of a string concatenation. Numeric constants
     * get the number affixes inside the operand affixes.
     */
    public static class TextOperandRule extends AffixRule {
        private String numberPrefix = "";
        private String numberSuffix = "";

        public String getNumberPrefix() {
            return numberPrefix;
        }

        public String getNumberSuffix() {
            return numberSuffix;
        }
    }

    public enum ConditionalClause {
        @JsonProperty("condition") CONDITION,
        @JsonProperty("consequent") CONSEQUENT,
        @JsonProperty("alternative") ALTERNATIVE
    }

    public static class ConditionalRule extends AffixRule {
        private List<ConditionalClause> order = new ArrayList<>();
        private AffixRule condition;
        private AffixRule consequent;
        private AffixRule alternative;

        public List<ConditionalClause> getOrder() {
            return order;
        }

        public AffixRule clause(ConditionalClause clause) {
            switch (clause) {
                case CONDITION:
                    return condition;
                case CONSEQUENT:
                    return consequent;
                default:
                    return alternative;
            }
        }
    }

    public static class CellRules {
        private AffixRule constant;
        private AffixRule text;
        @JsonProperty("boolean")
        private BooleanRule booleanRule;
        private EmptyRule empty;
        private ReferenceRule reference;
        private AffixRule variable;
        // Marks a computed cell, like the leading '=' of a formula
        private AffixRule operation;
        private AggregationRule aggregation;
        private OffsetRule offset;
        private TextOperandRule textOperand;

        public AffixRule getConstant() {
            return constant;
        }

        public AffixRule getText() {
            return text;
        }

        public BooleanRule getBooleanRule() {
            return booleanRule;
        }

        public EmptyRule getEmpty() {
            return empty;
        }

        public ReferenceRule getReference() {
            return reference;
        }

        public AffixRule getVariable() {
            return variable;
        }

        public AffixRule getOperation() {
            return operation;
        }

        public AggregationRule getAggregation() {
            return aggregation;
        }

        public OffsetRule getOffset() {
            return offset;
        }

        public TextOperandRule getTextOperand() {
            return textOperand;
        }
    }
}
