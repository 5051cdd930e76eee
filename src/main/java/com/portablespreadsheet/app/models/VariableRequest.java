package com.portablespreadsheet.app.models;

public class VariableRequest {
    private Object value;
    private Object description;

    public VariableRequest() {
    }

    public VariableRequest(Object value, Object description) {
        this.value = value;
        this.description = description;
    }

    public Object getValue() {
        return value;
    }
    public Object getDescription() {
        return description;
    }
    public void setValue(Object value) {
        this.value = value;
    }
    public void setDescription(Object description) {
        this.description = description;
    }
}
