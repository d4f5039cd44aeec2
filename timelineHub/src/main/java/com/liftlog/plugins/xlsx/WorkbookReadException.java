package com.liftlog.plugins.xlsx;

public class WorkbookReadException extends RuntimeException {
    public WorkbookReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
