package org.example.course.service;

import org.example.course.entity.ProgressionMode;
import org.example.course.model.Compaction;
import org.example.course.model.Course;
import org.example.course.model.Lesson;
import org.example.course.model.Memory;
import org.example.course.model.Section;
import org.example.course.model.Step;
import org.example.course.model.TopicMemory;
import org.example.course.service.llm.LlmCompletion;
import org.example.course.service.llm.LlmOptions;
import org.example.course.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.DoublePredicate;
import java.util.stream.Collectors;

/**
 * Folds completed history into the course memory every {@code course.compaction.interval} units.
 * Units are steps (by step index) for step courses and completed lessons (by completion ordinal)
 * for outline courses. Compaction mutates {@link Course#getMemory()} only; callers persist it.
 */
@Service
public class MemoryCompactor {

    private static final Logger log = LoggerFactory.getLogger(MemoryCompactor.class);
    static final String NO_HISTORY = "No prior learning history.";
    static final int RECENT_TOPIC_LIMIT = 5;
    private static final double STRENGTH_THRESHOLD = 0.7;
    private static final double WEAKNESS_THRESHOLD = 0.5;

    /**
     * One completed unit as seen by the compactor.
     */
    record CompletedUnit(int index, String topic, String title, Double score) {
    }

    private final ContentParser contentParser;
    private final LlmProvider compactionProvider;
    private final GenerationMetricsService metricsService;
    private final int interval;
    private final boolean llmSummaryEnabled;
    private final Clock clock;

    @Autowired
    public MemoryCompactor(
            ContentParser contentParser,
            @Qualifier("compactionLlmProvider") LlmProvider compactionProvider,
            GenerationMetricsService metricsService,
            @Value("${course.compaction.interval:10}") int interval,
            @Value("${course.compaction.llm-summary-enabled:true}") boolean llmSummaryEnabled) {
        this(contentParser, compactionProvider, metricsService, interval, llmSummaryEnabled, Clock.systemUTC());
    }

    MemoryCompactor(
            ContentParser contentParser,
            LlmProvider compactionProvider,
            GenerationMetricsService metricsService,
            int interval,
            boolean llmSummaryEnabled,
            Clock clock) {
        this.contentParser = contentParser;
        this.compactionProvider = compactionProvider;
        this.metricsService = metricsService;
        this.interval = Math.max(1, interval);
        this.llmSummaryEnabled = llmSummaryEnabled;
        this.clock = clock;
    }

    public int getInterval() {
        return interval;
    }

    /**
     * Notes that {@code topic} was just reviewed. Confidence only moves at compaction time.
     */
    public void recordOutcome(Course course, String topic) {
        if (topic == null || topic.isBlank()) {
            return;
        }
        TopicMemory memory = course.getMemory().getTopics().computeIfAbsent(topic, key -> new TopicMemory());
        memory.setTimesTested(memory.getTimesTested() + 1);
        memory.setLastReviewed(clock.instant());
    }

    public boolean shouldCompact(Course course, int completedIndex) {
        return completedIndex - course.getMemory().lastCompactedIndex() >= interval;
    }

    /**
     * Compacts when the trigger is met. Never throws: failures are logged and the course keeps
     * its un-compacted history until the next attempt.
     *
     * @return whether a new compaction boundary was recorded
     */
    public boolean maybeCompact(Course course, int completedIndex) {
        if (!shouldCompact(course, completedIndex)) {
            return false;
        }
        try {
            compact(course, completedIndex);
            return true;
        } catch (RuntimeException e) {
            log.warn("Memory compaction failed for course {} at index {}", course.getId(), completedIndex, e);
            return false;
        }
    }

    void compact(Course course, int completedIndex) {
        Memory memory = course.getMemory();
        int boundary = memory.lastCompactedIndex();
        List<CompletedUnit> folded = completedUnits(course).stream()
                .filter(unit -> unit.index() > boundary && unit.index() <= completedIndex)
                .toList();

        for (CompletedUnit unit : folded) {
            if (unit.score() == null || unit.topic() == null) {
                continue;
            }
            TopicMemory topic = memory.getTopics().computeIfAbsent(unit.topic(), key -> new TopicMemory());
            double normalized = unit.score() / 100.0;
            topic.setConfidence(topic.getConfidence() == 0 ? normalized : (topic.getConfidence() + normalized) / 2);
        }

        ContentParser.CompactionSummary summary = null;
        if (llmSummaryEnabled && compactionProvider.isAvailable()) {
            try {
                summary = summarizeWithGenerator(course, folded);
            } catch (RuntimeException e) {
                log.warn("Generator compaction failed for course {}; using extractive summary", course.getId(), e);
            }
        }
        boolean fallbackUsed = summary == null;
        if (fallbackUsed) {
            summary = extractiveSummary(memory, folded);
        }

        List<String> strengths = summary.strengths().isEmpty()
                ? topicsWhere(memory, confidence -> confidence >= STRENGTH_THRESHOLD)
                : summary.strengths();
        List<String> weaknesses = summary.weaknesses().isEmpty()
                ? topicsWhere(memory, confidence -> confidence < WEAKNESS_THRESHOLD)
                : summary.weaknesses();
        memory.setCompaction(new Compaction(
                summary.summary(), strengths, weaknesses, summary.recommendations(),
                completedIndex, clock.instant()));
        metricsService.recordCompaction(fallbackUsed);
        log.info("Compacted memory for course {}: {} units folded, boundary {} -> {}",
                course.getId(), folded.size(), boundary, completedIndex);
    }

    /**
     * Memory block embedded in generation prompts.
     */
    public String buildMemoryContext(Course course) {
        Memory memory = course.getMemory();
        List<String> parts = new ArrayList<>();
        Compaction compaction = memory.getCompaction();
        if (compaction != null) {
            parts.add("Learning Summary: " + compaction.summary());
            if (compaction.strengths() != null && !compaction.strengths().isEmpty()) {
                parts.add("Strengths: " + String.join(", ", compaction.strengths()));
            }
            if (compaction.weaknesses() != null && !compaction.weaknesses().isEmpty()) {
                parts.add("Areas needing work: " + String.join(", ", compaction.weaknesses()));
            }
        }
        if (!memory.getTopics().isEmpty()) {
            String scores = memory.getTopics().entrySet().stream()
                    .map(entry -> String.format(Locale.ROOT, "%s: %.0f%%",
                            entry.getKey(), entry.getValue().getConfidence() * 100))
                    .collect(Collectors.joining(", "));
            parts.add("Topic Confidence: " + scores);
        }
        return parts.isEmpty() ? NO_HISTORY : String.join("\n", parts);
    }

    /**
     * Topics of the last few units completed after the compaction boundary, oldest first.
     */
    public List<String> recentTopics(Course course) {
        int boundary = course.getMemory().lastCompactedIndex();
        List<String> topics = completedUnits(course).stream()
                .filter(unit -> unit.index() > boundary)
                .map(CompletedUnit::topic)
                .toList();
        return topics.subList(Math.max(0, topics.size() - RECENT_TOPIC_LIMIT), topics.size());
    }

    List<CompletedUnit> completedUnits(Course course) {
        List<CompletedUnit> units = new ArrayList<>();
        if (course.getProgressionMode() == ProgressionMode.STEPS) {
            for (Step step : course.getSteps()) {
                if (step.isCompleted()) {
                    units.add(new CompletedUnit(step.getIndex(), step.getTopic(), step.getTitle(), step.getScore()));
                }
            }
            return units;
        }
        if (course.getOutline() == null) {
            return units;
        }
        int ordinal = 0;
        for (Section section : course.getOutline().getSections()) {
            for (Lesson lesson : section.getLessons()) {
                if (!lesson.isCompleted()) {
                    continue;
                }
                Double score = lesson.isQuiz() && lesson.getProgress() != null
                        ? lesson.getProgress().derivedScore()
                        : null;
                units.add(new CompletedUnit(ordinal++, lesson.getTitle(), lesson.getTitle(), score));
            }
        }
        return units;
    }

    private ContentParser.CompactionSummary summarizeWithGenerator(Course course, List<CompletedUnit> folded) {
        String history = folded.stream()
                .map(unit -> unit.score() == null
                        ? String.format(Locale.ROOT, "- %s (%s)", unit.title(), unit.topic())
                        : String.format(Locale.ROOT, "- %s (%s): %.0f%%", unit.title(), unit.topic(), unit.score()))
                .collect(Collectors.joining("\n"));
        Compaction previous = course.getMemory().getCompaction();

        String prompt = String.format("""
            Summarize a learner's recent progress in the course "%s".

            PREVIOUS SUMMARY:
            %s

            UNITS COMPLETED SINCE THEN:
            %s

            OUTPUT REQUIREMENTS:
            - Return ONLY valid JSON (no markdown, no prose before/after).
            - summary: 2-4 sentences describing what the learner covered and how well.
            - strengths: topics the learner handles well.
            - weaknesses: topics that need more practice.
            - recommendations: 1-3 short suggestions for what to do next.

            JSON SCHEMA:
            {
              "summary": "string",
              "strengths": ["string"],
              "weaknesses": ["string"],
              "recommendations": ["string"]
            }
            """,
                course.getTitle(),
                previous == null ? "(none)" : previous.summary(),
                history.isBlank() ? "(none)" : history);

        LlmCompletion completion = compactionProvider.complete(prompt, LlmOptions.structured(0.2, 600));
        return contentParser.parseCompaction(completion.text());
    }

    private ContentParser.CompactionSummary extractiveSummary(Memory memory, List<CompletedUnit> folded) {
        Set<String> topics = folded.stream()
                .map(CompletedUnit::topic)
                .filter(topic -> topic != null && !topic.isBlank())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<Double> scores = folded.stream().map(CompletedUnit::score).filter(score -> score != null).toList();

        StringBuilder text = new StringBuilder();
        Compaction previous = memory.getCompaction();
        if (previous != null && previous.summary() != null && !previous.summary().isBlank()) {
            text.append(previous.summary()).append(' ');
        }
        text.append("Completed ").append(folded.size()).append(folded.size() == 1 ? " unit" : " units");
        if (!topics.isEmpty()) {
            text.append(" covering ").append(String.join(", ", topics));
        }
        text.append('.');
        if (!scores.isEmpty()) {
            double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            text.append(String.format(Locale.ROOT, " Average assessed score %.0f%%.", average));
        }

        List<String> weaknesses = topicsWhere(memory, confidence -> confidence < WEAKNESS_THRESHOLD);
        List<String> recommendations = weaknesses.stream().limit(3).map(topic -> "Review " + topic).toList();
        return new ContentParser.CompactionSummary(
                ContentParser.truncate(text.toString(), ContentParser.MAX_TEXT_LENGTH),
                topicsWhere(memory, confidence -> confidence >= STRENGTH_THRESHOLD),
                weaknesses,
                recommendations);
    }

    private List<String> topicsWhere(Memory memory, DoublePredicate predicate) {
        List<String> topics = new ArrayList<>();
        for (Map.Entry<String, TopicMemory> entry : memory.getTopics().entrySet()) {
            TopicMemory topic = entry.getValue();
            if (topic.getConfidence() > 0 && predicate.test(topic.getConfidence())) {
                topics.add(entry.getKey());
            }
        }
        return topics;
    }
}
