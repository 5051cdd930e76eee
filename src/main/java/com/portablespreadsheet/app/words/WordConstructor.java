package com.portablespreadsheet.app.words;

import com.portablespreadsheet.app.grammars.GrammarRegistry;
import com.portablespreadsheet.app.grammars.GrammarTable;
import com.portablespreadsheet.app.grammars.GrammarTable.AffixRule;
import com.portablespreadsheet.app.grammars.GrammarTable.AggregationRule;
import com.portablespreadsheet.app.grammars.GrammarTable.ConditionalClause;
import com.portablespreadsheet.app.grammars.GrammarTable.ConditionalRule;
import com.portablespreadsheet.app.grammars.GrammarTable.EndpointRule;
import com.portablespreadsheet.app.grammars.GrammarTable.OffsetClause;
import com.portablespreadsheet.app.grammars.GrammarTable.OffsetRule;
import com.portablespreadsheet.app.grammars.GrammarTable.ReferenceRule;
import com.portablespreadsheet.app.grammars.GrammarTable.TextOperandRule;
import com.portablespreadsheet.app.models.Cell;
import com.portablespreadsheet.app.operations.Aggregate;
import com.portablespreadsheet.app.operations.Operator;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the words of cells from the words of their operands.
 *
 * A word is built for every notation that is registered and for which
 * every operand has a word. The outer operation affixes (like the leading
 * '=' of a formula) are never applied here, only by {@link Cell#parse()}.
 */
public final class WordConstructor {

    private WordConstructor() {
    }

    /**
     * Word of a constant, or the empty content when the cell has no value.
     */
    public static Word constant(Cell cell) {
        GrammarRegistry grammars = grammars(cell);
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : grammars.listRegisteredNames()) {
            phrases.put(notation, constantPhrase(grammars.get(notation), cell.getValue()));
        }
        return new Word(phrases);
    }

    /**
     * Coordinates of an anchored cell.
     */
    public static Word reference(Cell cell) {
        GrammarRegistry grammars = grammars(cell);
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : grammars.listRegisteredNames()) {
            ReferenceRule rule = grammars.get(notation).getCells().getReference();
            phrases.put(notation, coordinates(rule, cell.getRow(), cell.getColumn()));
        }
        return new Word(phrases);
    }

    public static Word variable(Cell cell) {
        GrammarRegistry grammars = grammars(cell);
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : grammars.listRegisteredNames()) {
            AffixRule rule = grammars.get(notation).getCells().getVariable();
            phrases.put(notation, Phrase.text(cell.getVariableName()).wrap(rule.getPrefix(), rule.getSuffix()));
        }
        return new Word(phrases);
    }

    public static Word binary(Operator operator, Cell left, Cell right) {
        if (operator == Operator.CONCATENATE) {
            return concatenate(left, right);
        }
        GrammarRegistry grammars = grammars(left);
        Word leftWord = left.getWord();
        Word rightWord = right.getWord();
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : liveNotations(grammars, leftWord, rightWord)) {
            AffixRule rule = grammars.get(notation).operation(operator.getGrammarKey());
            phrases.put(notation, joined(rule, leftWord.get(notation), rightWord.get(notation)));
        }
        return new Word(phrases);
    }

    public static Word unary(Operator operator, Cell operand) {
        GrammarRegistry grammars = grammars(operand);
        Word word = operand.getWord();
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : liveNotations(grammars, word)) {
            AffixRule rule = grammars.get(notation).operation(operator.getGrammarKey());
            phrases.put(notation, word.get(notation).wrap(rule.getPrefix(), rule.getSuffix()));
        }
        return new Word(phrases);
    }

    /**
     * String concatenation. Each operand is wrapped as a text operand, and
     * constants are quoted so that numbers become strings.
     */
    public static Word concatenate(Cell left, Cell right) {
        GrammarRegistry grammars = grammars(left);
        Word leftWord = left.getWord();
        Word rightWord = right.getWord();
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : liveNotations(grammars, leftWord, rightWord)) {
            GrammarTable grammar = grammars.get(notation);
            AffixRule rule = grammar.operation(Operator.CONCATENATE.getGrammarKey());
            phrases.put(notation, joined(rule,
                    textOperand(grammar, left, leftWord.get(notation)),
                    textOperand(grammar, right, rightWord.get(notation))));
        }
        return new Word(phrases);
    }

    /**
     * Range from the start to the end cell. The members of the range do not
     * take part in the word.
     */
    public static Word aggregation(Aggregate aggregate, Cell start, Cell end) {
        GrammarRegistry grammars = grammars(start);
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : grammars.listRegisteredNames()) {
            GrammarTable grammar = grammars.get(notation);
            AggregationRule rule = grammar.getCells().getAggregation();
            int endRow = end.getRow() + (rule.isEndExclusive() ? 1 : 0);
            int endColumn = end.getColumn() + (rule.isEndExclusive() ? 1 : 0);
            Phrase range = endpoint(rule.getStartCell(), start.getRow(), start.getColumn(),
                    start.getRow(), start.getColumn(), endRow, endColumn)
                    .append(rule.getSeparator())
                    .append(endpoint(rule.getEndCell(), endRow, endColumn,
                            start.getRow(), start.getColumn(), endRow, endColumn))
                    .wrap(rule.getPrefix(), rule.getSuffix());
            AffixRule function = grammar.operation(aggregate.getGrammarKey());
            phrases.put(notation, range.wrap(function.getPrefix(), function.getSuffix()));
        }
        return new Word(phrases);
    }

    public static Word conditional(Cell condition, Cell consequent, Cell alternative) {
        GrammarRegistry grammars = grammars(condition);
        Word conditionWord = condition.getWord();
        Word consequentWord = consequent.getWord();
        Word alternativeWord = alternative.getWord();
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : liveNotations(grammars, conditionWord, consequentWord, alternativeWord)) {
            ConditionalRule rule = grammars.get(notation).getConditional();
            Phrase phrase = Phrase.empty();
            for (ConditionalClause clause : rule.getOrder()) {
                Phrase body;
                switch (clause) {
                    case CONDITION:
                        body = conditionWord.get(notation);
                        break;
                    case CONSEQUENT:
                        body = consequentWord.get(notation);
                        break;
                    default:
                        body = alternativeWord.get(notation);
                }
                AffixRule affixes = rule.clause(clause);
                phrase = phrase.append(body.wrap(affixes.getPrefix(), affixes.getSuffix()));
            }
            phrases.put(notation, phrase.wrap(rule.getPrefix(), rule.getSuffix()));
        }
        return new Word(phrases);
    }

    /**
     * Position shifted from an anchored reference cell by two skip expressions.
     */
    public static Word offset(Cell reference, Cell rowSkip, Cell columnSkip) {
        GrammarRegistry grammars = grammars(reference);
        Word rowSkipWord = rowSkip.getWord();
        Word columnSkipWord = columnSkip.getWord();
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : liveNotations(grammars, rowSkipWord, columnSkipWord)) {
            OffsetRule rule = grammars.get(notation).getCells().getOffset();
            Phrase phrase = Phrase.empty();
            for (OffsetClause clause : rule.getOrder()) {
                Phrase body;
                switch (clause) {
                    case REFERENCE_ROW:
                        body = Phrase.rowLabel(reference.getRow());
                        break;
                    case REFERENCE_COLUMN:
                        body = Phrase.columnLabel(reference.getColumn());
                        break;
                    case SKIP_ROWS:
                        body = rowSkipWord.get(notation);
                        break;
                    default:
                        body = columnSkipWord.get(notation);
                }
                AffixRule affixes = rule.clause(clause);
                phrase = phrase.append(body.wrap(affixes.getPrefix(), affixes.getSuffix()));
            }
            phrases.put(notation, phrase.wrap(rule.getPrefix(), rule.getSuffix()));
        }
        return new Word(phrases);
    }

    /**
     * Caller supplied text, taken verbatim for every registered notation it covers.
     */
    public static Word raw(Cell cell, Map<String, String> words) {
        GrammarRegistry grammars = grammars(cell);
        Map<String, Phrase> phrases = new LinkedHashMap<>();
        for (String notation : grammars.listRegisteredNames()) {
            if (words.containsKey(notation)) {
                phrases.put(notation, Phrase.text(words.get(notation)));
            }
        }
        return new Word(phrases);
    }

    private static GrammarRegistry grammars(Cell cell) {
        return cell.getCellIndices().getGrammars();
    }

    private static Set<String> liveNotations(GrammarRegistry grammars, Word... words) {
        Set<String> live = new LinkedHashSet<>(grammars.listRegisteredNames());
        for (Word word : words) {
            live.retainAll(word.getNotations());
        }
        return live;
    }

    private static Phrase constantPhrase(GrammarTable grammar, Object value) {
        if (value == null) {
            return Phrase.text(grammar.getCells().getEmpty().getContent());
        }
        if (value instanceof Boolean) {
            return Phrase.text(grammar.getCells().getBooleanRule().render((Boolean) value));
        }
        AffixRule rule = value instanceof String ? grammar.getCells().getText() : grammar.getCells().getConstant();
        return Phrase.text(String.valueOf(value)).wrap(rule.getPrefix(), rule.getSuffix());
    }

    private static Phrase joined(AffixRule rule, Phrase left, Phrase right) {
        return Phrase.text(rule.getPrefix())
                .append(left)
                .append(rule.getSeparator())
                .append(right)
                .append(rule.getSuffix());
    }

    private static Phrase textOperand(GrammarTable grammar, Cell operand, Phrase word) {
        TextOperandRule rule = grammar.getCells().getTextOperand();
        Phrase body = word;
        if (!operand.isAnchored() && !operand.isComputational() && operand.getValue() instanceof Number) {
            body = Phrase.text(String.valueOf(operand.getValue()))
                    .wrap(rule.getNumberPrefix(), rule.getNumberSuffix());
        }
        return body.wrap(rule.getPrefix(), rule.getSuffix());
    }

    private static Phrase coordinates(ReferenceRule rule, int row, int column) {
        Phrase rowLabel = Phrase.rowLabel(row);
        Phrase columnLabel = Phrase.columnLabel(column);
        Phrase first = rule.isRowFirst() ? rowLabel : columnLabel;
        Phrase second = rule.isRowFirst() ? columnLabel : rowLabel;
        return first.append(rule.getSeparator()).append(second).wrap(rule.getPrefix(), rule.getSuffix());
    }

    // Either the whole span of one axis or the own position of the endpoint
    private static Phrase endpoint(EndpointRule rule, int row, int column,
                                   int startRow, int startColumn, int endRow, int endColumn) {
        Phrase body;
        if (rule.isRowsOnly()) {
            body = Phrase.rowLabel(startRow).append(rule.getSeparator()).append(Phrase.rowLabel(endRow));
        } else if (rule.isColsOnly()) {
            body = Phrase.columnLabel(startColumn).append(rule.getSeparator()).append(Phrase.columnLabel(endColumn));
        } else {
            Phrase rowLabel = Phrase.rowLabel(row);
            Phrase columnLabel = Phrase.columnLabel(column);
            Phrase first = rule.isRowFirst() ? rowLabel : columnLabel;
            Phrase second = rule.isRowFirst() ? columnLabel : rowLabel;
            body = first.append(rule.getSeparator()).append(second);
        }
        return body.wrap(rule.getPrefix(), rule.getSuffix());
    }
}
