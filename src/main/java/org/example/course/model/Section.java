package org.example.course.model;

import java.util.ArrayList;
import java.util.List;

public class Section {

    private String id;
    private String title;
    private String description;
    private int estimatedMinutes;
    private List<String> learningOutcomes = new ArrayList<>();
    private List<Lesson> lessons = new ArrayList<>();
    private ProgressStatus status = ProgressStatus.PENDING;

    public Section() {}

    public Section(String id, String title, String description) {
        this.id = id;
        this.title = title;
        this.description = description;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public int getEstimatedMinutes() { return estimatedMinutes; }
    public void setEstimatedMinutes(int estimatedMinutes) { this.estimatedMinutes = estimatedMinutes; }

    public List<String> getLearningOutcomes() { return learningOutcomes; }
    public void setLearningOutcomes(List<String> learningOutcomes) {
        this.learningOutcomes = learningOutcomes == null ? new ArrayList<>() : learningOutcomes;
    }

    public List<Lesson> getLessons() { return lessons; }
    public void setLessons(List<Lesson> lessons) { this.lessons = lessons == null ? new ArrayList<>() : lessons; }

    public ProgressStatus getStatus() { return status; }
    public void setStatus(ProgressStatus status) { this.status = status; }
}
