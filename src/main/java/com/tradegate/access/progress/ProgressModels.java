package com.tradegate.access.progress;

public class ProgressModels {

    /**
     * One learner interaction. {@code score} is only taken into account when
     * {@code attempted} is set; {@code timeSpentSeconds} is added to the running total.
     */
    public record ProgressDelta(boolean completed, Double score, long timeSpentSeconds, boolean attempted) {
        public static ProgressDelta completion() {
            return new ProgressDelta(true, null, 0, false);
        }

        public static ProgressDelta attempt(double score) {
            return new ProgressDelta(true, score, 0, true);
        }
    }

    public record ProgressUpdate(String userId, String contentId, boolean completed, boolean newlyCompleted,
                                 Double score, Boolean passed, int attempts, long timeSpentSeconds,
                                 int signalsEnqueued) {}
}
