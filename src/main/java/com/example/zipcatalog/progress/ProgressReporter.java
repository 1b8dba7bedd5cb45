package com.example.zipcatalog.progress;

/**
 * Sink for status updates. Implementations must be safe to call from several scan workers at once.
 */
public interface ProgressReporter {

    default void scanProgress(ProgressEvent event) {
    }

    default void jobFinished(String jobId, String status, long archives, long entries) {
    }

    default void transferProgress(TransferProgress progress) {
    }

    /**
     * Reporter used when nobody is listening.
     */
    ProgressReporter NONE = new ProgressReporter() {
    };
}
