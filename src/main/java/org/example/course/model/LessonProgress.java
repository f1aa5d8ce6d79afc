package org.example.course.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class LessonProgress {

    private Instant startedAt;
    private Instant completedAt;
    private int currentBlockIndex;
    private List<BlockResult> blockResults = new ArrayList<>();
    private int timeSpent;

    public LessonProgress() {}

    public LessonProgress(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Optional<BlockResult> findResult(String blockId) {
        return blockResults.stream().filter(result -> result.blockId().equals(blockId)).findFirst();
    }

    /**
     * Replaces the result for the same block, or appends it.
     */
    public void upsert(BlockResult result) {
        for (int i = 0; i < blockResults.size(); i++) {
            if (blockResults.get(i).blockId().equals(result.blockId())) {
                blockResults.set(i, result);
                return;
            }
        }
        blockResults.add(result);
    }

    /**
     * Average over results that carry a score or belong to question blocks; 100 when none do.
     */
    public double derivedScore() {
        double total = 0;
        int scored = 0;
        for (BlockResult result : blockResults) {
            if (result.score() > 0 || result.blockType() == BlockType.QUESTION) {
                total += result.score();
                scored++;
            }
        }
        return scored == 0 ? 100 : total / scored;
    }

    public boolean isComplete(int totalBlocks) {
        if (totalBlocks <= 0 || blockResults.size() < totalBlocks) {
            return false;
        }
        return blockResults.stream().allMatch(BlockResult::completed);
    }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public int getCurrentBlockIndex() { return currentBlockIndex; }
    public void setCurrentBlockIndex(int currentBlockIndex) { this.currentBlockIndex = currentBlockIndex; }

    public List<BlockResult> getBlockResults() { return blockResults; }
    public void setBlockResults(List<BlockResult> blockResults) {
        this.blockResults = blockResults == null ? new ArrayList<>() : blockResults;
    }

    public int getTimeSpent() { return timeSpent; }
    public void setTimeSpent(int timeSpent) { this.timeSpent = timeSpent; }
}
