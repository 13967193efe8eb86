package org.astroseq.engine;

/**
 * Receives progress notifications while a run is in progress. Called concurrently from the
 * worker threads.
 */
public interface IProgressListener {

    IProgressListener NONE = new IProgressListener() {
        @Override
        public void onProgress(int completed, int total) {
        }
    };

    default void onStart(String sequenceName, int total) {
    }

    /**
     * @param completed Frames handled so far (converted, failed or skipped).
     * @param total     Number of selected frames.
     */
    void onProgress(int completed, int total);

    default void onFinish(RunResult result) {
    }
}
