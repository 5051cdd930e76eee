package com.portablespreadsheet.app.services;

import com.portablespreadsheet.app.config.SpreadsheetProperties;
import com.portablespreadsheet.app.exceptions.AnchoringException;
import com.portablespreadsheet.app.exceptions.InvalidCellAttributeException;
import com.portablespreadsheet.app.exceptions.InvalidExpressionException;
import com.portablespreadsheet.app.exceptions.SheetNotFoundException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import com.portablespreadsheet.app.models.*;
import com.portablespreadsheet.app.operations.Aggregate;
import com.portablespreadsheet.app.operations.CellValues;
import com.portablespreadsheet.app.operations.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating sheets, building cells from expression
 * requests, defining variables and deleting rows or columns.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent DB
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final GrammarRegistry grammars;
    private final boolean excelLabelOffset;

    @Autowired
    public SheetService(GrammarRegistry grammars, SpreadsheetProperties properties) {
        this.grammars = grammars;
        this.excelLabelOffset = properties.isExcelLabelOffset();
    }

    /**
     * Creates a new Sheet of bare cells and returns its ID.
     */
    public long createSheet(SheetRequest request) {
        CellIndices indices = CellIndices.builder(request.getRows(), request.getColumns())
                .grammars(grammars)
                .excelLabelOffset(excelLabelOffset)
                .rowLabels(request.getRowLabels())
                .columnLabels(request.getColumnLabels())
                .build();
        Sheet sheet = new Sheet(indices);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} with {} rows and {} columns", sheet.getId(), request.getRows(), request.getColumns());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    /**
     * Builds the cell described by the request and places it in the sheet.
     * Nothing changes in the sheet if building fails.
     */
    public CellView setCellValue(long sheetId, int row, int column, ExpressionRequest request) {
        Sheet sheet = getSheet(sheetId);

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            String description = description(request.getDescription());
            Map<String, Object> style = style(request.getStyle());
            // Fails on bad coordinates before anything is built
            sheet.getCell(row, column);

            Cell built = build(sheet, request);
            Cell placed = sheet.setCell(row, column, built);
            if (description != null) {
                placed.setDescription(description);
            }
            if (style != null) {
                placed.setStyle(style);
            }
            log.debug("Sheet {}: cell ({}, {}) set by {}", sheetId, row, column, request.getOperation());
            return CellView.of(placed);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public CellView getCell(long sheetId, int row, int column) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return CellView.of(sheet.getCell(row, column));
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of "row,column" -> cell view for every cell that holds
     * a value or a computation.
     */
    public Map<String, CellView> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, CellView> data = new LinkedHashMap<>();
            for (int row = 0; row < sheet.getNumberOfRows(); row++) {
                for (int column = 0; column < sheet.getNumberOfColumns(); column++) {
                    Cell cell = sheet.getCell(row, column);
                    if (cell.getValue() != null || cell.isComputational()) {
                        data.put(row + "," + column, CellView.of(cell));
                    }
                }
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellView defineVariable(long sheetId, String name, VariableRequest request) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            Cell variable = sheet.defineVariable(name, request.getValue(), description(request.getDescription()));
            log.debug("Sheet {}: variable {} defined", sheetId, name);
            return CellView.of(variable);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public void deleteRow(long sheetId, int row) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            sheet.deleteRow(row);
            log.info("Sheet {}: row {} deleted", sheetId, row);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public void deleteColumn(long sheetId, int column) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            sheet.deleteColumn(column);
            log.info("Sheet {}: column {} deleted", sheetId, column);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Builds a cell from the request tree, leaves first.
     */
    Cell build(Sheet sheet, ExpressionRequest request) {
        String operation = request.getOperation();
        if (operation == null) {
            throw new InvalidExpressionException("Expression has no operation");
        }
        switch (operation) {
            case "constant":
                arguments(request, 0);
                return new Cell(request.getValue(), sheet.getCellIndices());
            case "cell":
                arguments(request, 0);
                return sheet.getCell(coordinate(request.getRow(), "row"), coordinate(request.getColumn(), "column"));
            case "reference":
                return Cell.reference(build(sheet, arguments(request, 1).get(0)));
            case "variable":
                arguments(request, 0);
                return Cell.variable(sheet.getVariable(request.getName()));
            case "conditional": {
                List<ExpressionRequest> args = arguments(request, 3);
                return Cell.conditional(build(sheet, args.get(0)), build(sheet, args.get(1)), build(sheet, args.get(2)));
            }
            case "offset":
                return offset(sheet, arguments(request, 3));
            case "raw":
                if (request.getWords() == null) {
                    throw new InvalidExpressionException("Operation raw needs words");
                }
                return Cell.raw(build(sheet, arguments(request, 1).get(0)), request.getWords());
            default:
                break;
        }
        Optional<Operator> operator = Operator.fromGrammarKey(operation);
        if (operator.isPresent()) {
            if (operator.get().isBinary()) {
                List<ExpressionRequest> args = arguments(request, 2);
                return build(sheet, args.get(0)).apply(operator.get(), build(sheet, args.get(1)));
            }
            return Cell.applyUnary(operator.get(), build(sheet, arguments(request, 1).get(0)));
        }
        Optional<Aggregate> aggregate = Aggregate.fromGrammarKey(operation);
        if (aggregate.isPresent()) {
            return aggregate(sheet, aggregate.get(), arguments(request, 2));
        }
        throw new InvalidExpressionException("Unknown operation: " + operation);
    }

    // Members are the cells of the range holding a value
    private Cell aggregate(Sheet sheet, Aggregate aggregate, List<ExpressionRequest> args) {
        Cell start = build(sheet, args.get(0));
        Cell end = build(sheet, args.get(1));
        if (!start.isAnchored() || !end.isAnchored()) {
            throw new AnchoringException("Operation " + aggregate.getGrammarKey() + " needs anchored range ends");
        }
        List<Cell> members = new ArrayList<>();
        for (Cell member : sheet.slice(start.getRow(), start.getColumn(), end.getRow(), end.getColumn())) {
            if (member.getValue() != null) {
                members.add(member);
            }
        }
        return Cell.aggregate(aggregate, start, end, members);
    }

    private Cell offset(Sheet sheet, List<ExpressionRequest> args) {
        Cell reference = build(sheet, args.get(0));
        Cell rowSkip = build(sheet, args.get(1));
        Cell columnSkip = build(sheet, args.get(2));
        if (!reference.isAnchored()) {
            throw new AnchoringException("Operation offset needs an anchored reference cell");
        }
        Cell target = sheet.getCell(reference.getRow() + CellValues.toIndex(rowSkip.getValue(), "offset"),
                reference.getColumn() + CellValues.toIndex(columnSkip.getValue(), "offset"));
        return Cell.offset(reference, rowSkip, columnSkip, target);
    }

    private static List<ExpressionRequest> arguments(ExpressionRequest request, int expected) {
        List<ExpressionRequest> args = request.getArguments() == null
                ? Collections.emptyList() : request.getArguments();
        if (args.size() != expected) {
            throw new InvalidExpressionException("Operation " + request.getOperation() + " takes "
                    + expected + " arguments, got " + args.size());
        }
        return args;
    }

    private static int coordinate(Integer value, String name) {
        if (value == null) {
            throw new InvalidExpressionException("Operation cell needs a " + name);
        }
        return value;
    }

    private static String description(Object description) {
        if (description != null && !(description instanceof String)) {
            throw new InvalidCellAttributeException("Description must be text");
        }
        return (String) description;
    }

    private static Map<String, Object> style(Object style) {
        if (style == null) {
            return null;
        }
        if (!(style instanceof Map)) {
            throw new InvalidCellAttributeException("Style must be a mapping");
        }
        return Cell.checkStyle((Map<?, ?>) style);
    }
}
