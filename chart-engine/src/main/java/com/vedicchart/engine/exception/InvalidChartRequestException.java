package com.vedicchart.engine.exception;

public class InvalidChartRequestException extends RuntimeException {

    private final String field;

    public InvalidChartRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
