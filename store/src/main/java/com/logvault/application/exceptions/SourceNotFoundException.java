package com.logvault.application.exceptions;

public class SourceNotFoundException extends LogVaultException {
    public SourceNotFoundException(String source) {
        super(ErrorKind.SOURCE_NOT_FOUND, "File not found: " + source);
    }

    public SourceNotFoundException(String source, Throwable cause) {
        super(ErrorKind.SOURCE_NOT_FOUND, "File not readable: " + source, cause);
    }
}
