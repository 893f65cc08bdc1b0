package com.cgi.piiscan.dbscanner.service;

/**
 * Receives scan progress. Invoked from a single thread with non-decreasing completion counts.
 */
@FunctionalInterface
public interface ProgressSink {
    /**
     * Called after the schema is analyzed and after every table completes.
     *
     * @param completed Tables completed so far
     * @param total Tables selected for scanning
     * @param message Human-readable status
     */
    void onProgress(int completed, int total, String message);

    /**
     * A sink that ignores all progress.
     *
     * @return No-op sink
     */
    static ProgressSink none() {
        return (completed, total, message) -> { };
    }
}
