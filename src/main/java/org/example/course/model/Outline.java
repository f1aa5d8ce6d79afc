package org.example.course.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Outline {

    private String title;
    private String description;
    private int estimatedMinutes;
    private List<String> prerequisites = new ArrayList<>();
    private List<String> learningOutcomes = new ArrayList<>();
    private List<Section> sections = new ArrayList<>();
    private Metadata metadata;
    private Instant generatedAt;

    public record Metadata(String difficulty, String category, List<String> tags) {
    }

    public int countLessons() {
        return sections.stream().mapToInt(section -> section.getLessons().size()).sum();
    }

    public int countCompletedLessons() {
        return (int) sections.stream()
                .flatMap(section -> section.getLessons().stream())
                .filter(Lesson::isCompleted)
                .count();
    }

    public Optional<Section> findSection(String sectionId) {
        return sections.stream().filter(section -> section.getId().equals(sectionId)).findFirst();
    }

    public Optional<Lesson> findLesson(String sectionId, String lessonId) {
        return findSection(sectionId)
                .flatMap(section -> section.getLessons().stream()
                        .filter(lesson -> lesson.getId().equals(lessonId))
                        .findFirst());
    }

    public Optional<Lesson> lessonAt(LessonPosition position) {
        if (position == null
                || position.sectionIndex() < 0 || position.sectionIndex() >= sections.size()) {
            return Optional.empty();
        }
        List<Lesson> lessons = sections.get(position.sectionIndex()).getLessons();
        if (position.lessonIndex() < 0 || position.lessonIndex() >= lessons.size()) {
            return Optional.empty();
        }
        return Optional.of(lessons.get(position.lessonIndex()));
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public int getEstimatedMinutes() { return estimatedMinutes; }
    public void setEstimatedMinutes(int estimatedMinutes) { this.estimatedMinutes = estimatedMinutes; }

    public List<String> getPrerequisites() { return prerequisites; }
    public void setPrerequisites(List<String> prerequisites) {
        this.prerequisites = prerequisites == null ? new ArrayList<>() : prerequisites;
    }

    public List<String> getLearningOutcomes() { return learningOutcomes; }
    public void setLearningOutcomes(List<String> learningOutcomes) {
        this.learningOutcomes = learningOutcomes == null ? new ArrayList<>() : learningOutcomes;
    }

    public List<Section> getSections() { return sections; }
    public void setSections(List<Section> sections) { this.sections = sections == null ? new ArrayList<>() : sections; }

    public Metadata getMetadata() { return metadata; }
    public void setMetadata(Metadata metadata) { this.metadata = metadata; }

    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }
}
