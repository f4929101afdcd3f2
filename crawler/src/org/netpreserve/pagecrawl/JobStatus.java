package org.netpreserve.pagecrawl;

public enum JobStatus {
    PENDING, IN_PROGRESS, COMPLETED, COMPLETED_WITH_ERRORS, INTERRUPTED;

    public boolean isFinished() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == INTERRUPTED;
    }
}
