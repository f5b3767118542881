package com.logvault.application.exceptions;

public class StorageException extends LogVaultException {

    private final int committedBeforeFailure;

    public StorageException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public StorageException(String message, Throwable cause, int committedBeforeFailure) {
        super(ErrorKind.STORAGE, message, cause);
        this.committedBeforeFailure = committedBeforeFailure;
    }

    public int getCommittedBeforeFailure() {
        return committedBeforeFailure;
    }
}
