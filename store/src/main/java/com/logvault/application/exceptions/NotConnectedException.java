package com.logvault.application.exceptions;

public class NotConnectedException extends LogVaultException {
    public NotConnectedException(String dbPath) {
        super(ErrorKind.NOT_CONNECTED, "Store is not open: " + dbPath);
    }
}
