package com.logvault.domain;

public final class BatchResult {

    private final int committed;
    private final String failureReason;
    private final Exception cause;

    private BatchResult(int committed, String failureReason, Exception cause) {
        this.committed = committed;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static BatchResult committed(int count) {
        return new BatchResult(count, null, null);
    }

    public static BatchResult failed(String reason, Exception cause) {
        return new BatchResult(0, reason, cause);
    }

    public boolean isCommitted() {
        return failureReason == null;
    }

    public int getCommitted() {
        return committed;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isCommitted()
                ? "BatchResult{committed=" + committed + "}"
                : "BatchResult{failed='" + failureReason + "'}";
    }
}
