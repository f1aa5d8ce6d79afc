package org.example.course.model;

import java.time.Instant;

public class TopicMemory {

    private double confidence;
    private Instant lastReviewed;
    private int timesTested;

    public TopicMemory() {}

    public TopicMemory(double confidence, Instant lastReviewed, int timesTested) {
        this.confidence = confidence;
        this.lastReviewed = lastReviewed;
        this.timesTested = timesTested;
    }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = Math.max(0.0, Math.min(1.0, confidence)); }

    public Instant getLastReviewed() { return lastReviewed; }
    public void setLastReviewed(Instant lastReviewed) { this.lastReviewed = lastReviewed; }

    public int getTimesTested() { return timesTested; }
    public void setTimesTested(int timesTested) { this.timesTested = timesTested; }
}
