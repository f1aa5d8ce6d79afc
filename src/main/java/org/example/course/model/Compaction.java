package org.example.course.model;

import java.time.Instant;
import java.util.List;

/**
 * Boundary of folded history. Units up to and including {@code lastStepIndex} are summarized.
 */
public record Compaction(
        String summary,
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations,
        int lastStepIndex,
        Instant compactedAt) {
}
