package com.ragmodule.store;

import java.io.IOException;
import java.util.Locale;

public class QdrantException extends IOException {
    private final int statusCode;

    public QdrantException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        String message = getMessage() == null ? "" : getMessage().toLowerCase(Locale.ROOT);
        return statusCode == 404 || message.contains("not found") || message.contains("doesn't exist");
    }
}
