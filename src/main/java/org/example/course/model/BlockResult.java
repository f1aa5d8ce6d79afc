package org.example.course.model;

import java.time.Instant;
import java.util.Objects;

public record BlockResult(
        String blockId,
        BlockType blockType,
        boolean completed,
        Instant completedAt,
        String userAnswer,
        Boolean isCorrect,
        double score,
        int attempts,
        int timeSpent) {

    /**
     * Same submission as {@code other}, ignoring bookkeeping fields.
     */
    public boolean sameOutcomeAs(BlockResult other) {
        return other != null
                && completed == other.completed
                && Double.compare(score, other.score) == 0
                && Objects.equals(userAnswer, other.userAnswer)
                && Objects.equals(isCorrect, other.isCorrect);
    }
}
