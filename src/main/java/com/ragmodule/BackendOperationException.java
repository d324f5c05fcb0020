package com.ragmodule;

public class BackendOperationException extends RagException {
    private final String operation;

    public BackendOperationException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
