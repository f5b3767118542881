package com.logvault.application.exceptions;

public abstract class LogVaultException extends RuntimeException {

    private final ErrorKind kind;

    protected LogVaultException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LogVaultException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
