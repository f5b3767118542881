package com.logvault.application.exceptions;

public enum ErrorKind {
    SOURCE_NOT_FOUND,
    STORAGE,
    QUERY,
    NOT_CONNECTED
}
