package com.ragmodule;

public class NotReadyException extends RagException {
    public NotReadyException(String message) {
        super(message);
    }
}
