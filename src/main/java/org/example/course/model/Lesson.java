package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Lesson {

    private String id;
    private String title;
    private String description;
    private int estimatedMinutes;
    private GenerationStatus blocksStatus = GenerationStatus.PENDING;
    private String blocksError;
    private List<Block> blocks = new ArrayList<>();
    private ProgressStatus status = ProgressStatus.PENDING;
    private LessonProgress progress;

    public Lesson() {}

    public Lesson(String id, String title, String description, int estimatedMinutes) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.estimatedMinutes = estimatedMinutes;
    }

    public Optional<Block> findBlock(String blockId) {
        return blocks.stream().filter(block -> block.getId().equals(blockId)).findFirst();
    }

    /**
     * Lessons containing at least one question block are graded like quizzes.
     */
    @JsonIgnore
    public boolean isQuiz() {
        return blocks.stream().anyMatch(block -> block.getType() == BlockType.QUESTION);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ProgressStatus.COMPLETED;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public int getEstimatedMinutes() { return estimatedMinutes; }
    public void setEstimatedMinutes(int estimatedMinutes) { this.estimatedMinutes = estimatedMinutes; }

    public GenerationStatus getBlocksStatus() { return blocksStatus; }
    public void setBlocksStatus(GenerationStatus blocksStatus) { this.blocksStatus = blocksStatus; }

    public String getBlocksError() { return blocksError; }
    public void setBlocksError(String blocksError) { this.blocksError = blocksError; }

    public List<Block> getBlocks() { return blocks; }
    public void setBlocks(List<Block> blocks) { this.blocks = blocks == null ? new ArrayList<>() : blocks; }

    public ProgressStatus getStatus() { return status; }
    public void setStatus(ProgressStatus status) { this.status = status; }

    public LessonProgress getProgress() { return progress; }
    public void setProgress(LessonProgress progress) { this.progress = progress; }
}
