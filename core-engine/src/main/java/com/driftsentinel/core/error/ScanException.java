package com.driftsentinel.core.error;

/**
 * Drift detection failed for one file. The file is skipped for this cycle and
 * retried on the next one.
 */
public class ScanException extends DriftSentinelException {

    private static final long serialVersionUID = 1L;

    private final String filePath;

    public ScanException(String filePath, String message, Throwable cause) {
        super(ErrorCode.SCAN_FAILED, message, cause);
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }
}
