package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Unit of the flat step model. Index is assigned on append and never renumbered.
 */
public class Step {

    private String id;
    private int index;
    private StepType type;
    private String topic;
    private String title;
    private String content;
    private String question;
    private List<String> options = new ArrayList<>();
    private String expectedAnswer;
    private String task;
    private List<String> hints = new ArrayList<>();
    private boolean completed;
    private Instant completedAt;
    private String userAnswer;
    private Double score;
    private Instant createdAt;

    @JsonIgnore
    public boolean isQuiz() {
        return type == StepType.QUIZ;
    }

    @JsonIgnore
    public boolean isPassed() {
        if (!completed) {
            return false;
        }
        return !isQuiz() || (score != null && score >= 70);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public StepType getType() { return type; }
    public void setType(StepType type) { this.type = type; }

    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question; }

    public List<String> getOptions() { return options; }
    public void setOptions(List<String> options) { this.options = options == null ? new ArrayList<>() : options; }

    public String getExpectedAnswer() { return expectedAnswer; }
    public void setExpectedAnswer(String expectedAnswer) { this.expectedAnswer = expectedAnswer; }

    public String getTask() { return task; }
    public void setTask(String task) { this.task = task; }

    public List<String> getHints() { return hints; }
    public void setHints(List<String> hints) { this.hints = hints == null ? new ArrayList<>() : hints; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public String getUserAnswer() { return userAnswer; }
    public void setUserAnswer(String userAnswer) { this.userAnswer = userAnswer; }

    public Double getScore() { return score; }
    public void setScore(Double score) { this.score = score; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
