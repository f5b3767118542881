package com.logvault.application.exceptions;

public class QueryException extends LogVaultException {
    public QueryException(String matchExpression, Throwable cause) {
        super(ErrorKind.QUERY, "Match expression rejected: " + matchExpression, cause);
    }
}
