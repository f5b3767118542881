package com.logvault.application.exceptions;

import com.logvault.domain.ImportStats;

public class ImportFailedException extends LogVaultException {

    private final ImportStats partialStats;

    public ImportFailedException(String source, ImportStats partialStats, LogVaultException cause) {
        super(cause.getKind(), "Import of " + source + " aborted after " + partialStats.imported() + " records: "
                + cause.getMessage(), cause);
        this.partialStats = partialStats;
    }

    public ImportStats getPartialStats() {
        return partialStats;
    }
}
