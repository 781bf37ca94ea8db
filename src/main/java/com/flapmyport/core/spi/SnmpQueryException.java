package com.flapmyport.core.spi;

public class SnmpQueryException extends Exception {
    public SnmpQueryException(String message) {
        super(message);
    }

    public SnmpQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
