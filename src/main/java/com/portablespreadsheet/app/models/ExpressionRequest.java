package com.portablespreadsheet.app.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A structured expression, as sent in JSON:
 * { "operation": "add", "arguments": [ {"operation": "cell", "row": 0, "column": 1},
 *                                      {"operation": "constant", "value": 3} ] }
 *
 * Description and style are only read on the top-level request and are
 * kept untyped so that wrong types can be reported as invalid attributes.
 */
public class ExpressionRequest {
    private String operation;
    private Object value;
    private Integer row;
    private Integer column;
    private String name;
    private List<ExpressionRequest> arguments = new ArrayList<>();
    private Map<String, String> words;
    private Object description;
    private Object style;

    // Default constructor needed for JSON (de)serialization
    public ExpressionRequest() {
    }

    public ExpressionRequest(String operation, List<ExpressionRequest> arguments) {
        this.operation = operation;
        this.arguments = arguments;
    }

    public static ExpressionRequest constant(Object value) {
        ExpressionRequest request = new ExpressionRequest();
        request.setOperation("constant");
        request.setValue(value);
        return request;
    }

    public static ExpressionRequest cell(int row, int column) {
        ExpressionRequest request = new ExpressionRequest();
        request.setOperation("cell");
        request.setRow(row);
        request.setColumn(column);
        return request;
    }

    public static ExpressionRequest variable(String name) {
        ExpressionRequest request = new ExpressionRequest();
        request.setOperation("variable");
        request.setName(name);
        return request;
    }

    public static ExpressionRequest of(String operation, ExpressionRequest... arguments) {
        return new ExpressionRequest(operation, new ArrayList<>(List.of(arguments)));
    }

    public String getOperation() {
        return operation;
    }
    public Object getValue() {
        return value;
    }
    public Integer getRow() {
        return row;
    }
    public Integer getColumn() {
        return column;
    }
    public String getName() {
        return name;
    }
    public List<ExpressionRequest> getArguments() {
        return arguments;
    }
    public Map<String, String> getWords() {
        return words;
    }
    public Object getDescription() {
        return description;
    }
    public Object getStyle() {
        return style;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }
    public void setValue(Object value) {
        this.value = value;
    }
    public void setRow(Integer row) {
        this.row = row;
    }
    public void setColumn(Integer column) {
        this.column = column;
    }
    public void setName(String name) {
        this.name = name;
    }
    public void setArguments(List<ExpressionRequest> arguments) {
        this.arguments = arguments;
    }
    public void setWords(Map<String, String> words) {
        this.words = words;
    }
    public void setDescription(Object description) {
        this.description = description;
    }
    public void setStyle(Object style) {
        this.style = style;
    }
}
