package org.example.course.service;

import org.example.course.model.Block;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.Lesson;
import org.example.course.model.Outline;
import org.example.course.model.Section;
import org.example.course.model.UnitRequest;
import org.example.course.service.llm.LlmOptions;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the generator prompt for one unit request. Each prompt asks for a bare JSON object in
 * the shape {@link ContentParser} reads back.
 */
@Component
public class UnitPromptBuilder {

    private final MemoryCompactor memoryCompactor;

    public UnitPromptBuilder(MemoryCompactor memoryCompactor) {
        this.memoryCompactor = memoryCompactor;
    }

    public String build(Course course, UnitRequest request) {
        return switch (request.kind()) {
            case OUTLINE -> outlinePrompt(course);
            case NEXT_STEP -> stepPrompt(course, request);
            case LESSON_BLOCKS -> blocksPrompt(course, request);
            case BLOCK_CONTENT -> blockContentPrompt(course, request);
        };
    }

    public LlmOptions options(UnitRequest request) {
        return switch (request.kind()) {
            case OUTLINE -> LlmOptions.structured(0.4, 4000);
            case NEXT_STEP -> LlmOptions.structured(0.6, 2000);
            case LESSON_BLOCKS -> LlmOptions.structured(0.4, 1500);
            case BLOCK_CONTENT -> LlmOptions.structured(0.5, 2500);
        };
    }

    private String outlinePrompt(Course course) {
        return String.format("""
            Design a structured course for a learner whose goal is: "%s".

            RULES:
            - 3-6 sections, each with 2-5 lessons, ordered from fundamentals to advanced.
            - Lesson titles are short and specific.
            - estimatedMinutes are realistic integers.

            OUTPUT REQUIREMENTS:
            - Return ONLY valid JSON (no markdown, no prose before/after).

            JSON SCHEMA:
            {
              "title": "string",
              "description": "string",
              "estimatedMinutes": 0,
              "prerequisites": ["string"],
              "learningOutcomes": ["string"],
              "metadata": {"difficulty": "beginner|intermediate|advanced", "category": "string", "tags": ["string"]},
              "sections": [
                {
                  "title": "string",
                  "description": "string",
                  "estimatedMinutes": 0,
                  "learningOutcomes": ["string"],
                  "lessons": [
                    {"title": "string", "description": "string", "estimatedMinutes": 0}
                  ]
                }
              ]
            }
            """, course.getTitle());
    }

    private String stepPrompt(Course course, UnitRequest request) {
        List<String> recentTopics = memoryCompactor.recentTopics(course);
        String outlineContext = "";
        Outline outline = course.getOutline();
        if (outline != null) {
            outlineContext = outline.lessonAt(course.getCurrentPosition())
                    .map(lesson -> "CURRENT OUTLINE TOPIC: " + lesson.getTitle()
                            + (lesson.getDescription() == null ? "" : " - " + lesson.getDescription()) + "\n")
                    .orElse("");
        }
        return String.format("""
            Create the next learning step for a learner working toward: "%s".

            STEPS COMPLETED SO FAR: %d
            RECENT TOPICS: %s
            %s
            LEARNER MEMORY:
            %s

            RULES:
            - Pick the next topic that builds on what the learner already knows.
            - type is one of lesson, quiz, exercise. Use quiz to check weak topics.
            - A quiz needs a question, options when multiple choice, and expectedAnswer.
            - An exercise needs a task and hints.
            - content is markdown, at most 1500 words.

            OUTPUT REQUIREMENTS:
            - Return ONLY valid JSON (no markdown, no prose before/after).

            JSON SCHEMA:
            {
              "type": "lesson|quiz|exercise",
              "topic": "string",
              "title": "string",
              "content": "string",
              "question": "string",
              "options": ["string"],
              "expectedAnswer": "string",
              "task": "string",
              "hints": ["string"]
            }
            """,
                course.getTitle(),
                request.stepIndex() == null ? course.getSteps().size() : request.stepIndex(),
                recentTopics.isEmpty() ? "(none)" : String.join(", ", recentTopics),
                outlineContext,
                memoryCompactor.buildMemoryContext(course));
    }

    private String blocksPrompt(Course course, UnitRequest request) {
        Outline outline = requireOutline(course);
        Section section = outline.findSection(request.sectionId())
                .orElseThrow(() -> new ValidationException("Unknown section: " + request.sectionId()));
        Lesson lesson = outline.findLesson(request.sectionId(), request.lessonId())
                .orElseThrow(() -> new ValidationException("Unknown lesson: " + request.lessonId()));
        String blockTypes = Arrays.stream(BlockType.values())
                .map(BlockType::value)
                .collect(Collectors.joining("|"));

        return String.format("""
            Plan the blocks of one lesson in the course "%s".

            SECTION: %s
            LESSON: %s
            LESSON DESCRIPTION: %s
            LEARNER MEMORY:
            %s

            RULES:
            - 4-8 blocks in teaching order. Only plan them; content is written later.
            - Start with text, include at least one question block, end with a summary block.
            - purpose says in one sentence what the block must teach or check.

            OUTPUT REQUIREMENTS:
            - Return ONLY valid JSON (no markdown, no prose before/after).

            JSON SCHEMA:
            {
              "blocks": [
                {"type": "%s", "title": "string", "purpose": "string", "order": 0}
              ]
            }
            """,
                outlineTitle(course, outline),
                section.getTitle(),
                lesson.getTitle(),
                lesson.getDescription() == null ? "" : lesson.getDescription(),
                memoryCompactor.buildMemoryContext(course),
                blockTypes);
    }

    private String blockContentPrompt(Course course, UnitRequest request) {
        Outline outline = requireOutline(course);
        Lesson lesson = outline.findLesson(request.sectionId(), request.lessonId())
                .orElseThrow(() -> new ValidationException("Unknown lesson: " + request.lessonId()));
        Block block = lesson.findBlock(request.blockId())
                .orElseThrow(() -> new ValidationException("Unknown block: " + request.blockId()));
        String siblings = lesson.getBlocks().stream()
                .map(other -> "- " + other.getType().value() + ": " + (other.getTitle() == null ? "" : other.getTitle()))
                .collect(Collectors.joining("\n"));

        return String.format("""
            Write the content of one %s block for the lesson "%s" in the course "%s".

            BLOCK TITLE: %s
            BLOCK PURPOSE: %s

            LESSON PLAN:
            %s

            LEARNER MEMORY:
            %s

            OUTPUT REQUIREMENTS:
            - Return ONLY valid JSON (no markdown, no prose before/after).

            JSON SCHEMA:
            %s
            """,
                block.getType().value(),
                lesson.getTitle(),
                outlineTitle(course, outline),
                block.getTitle() == null ? "" : block.getTitle(),
                block.getPurpose() == null ? "" : block.getPurpose(),
                siblings,
                memoryCompactor.buildMemoryContext(course),
                contentSchema(block.getType()));
    }

    private String contentSchema(BlockType type) {
        return switch (type) {
            case TEXT -> "{\"markdown\": \"string\"}";
            case CODE -> "{\"language\": \"string\", \"code\": \"string\", \"explanation\": \"string\", \"runnable\": false}";
            case QUESTION -> """
                {"question": {"text": "string", "type": "multiple_choice|true_false|fill_blank|short_answer|code",
                  "options": [{"id": "a", "text": "string"}], "correctAnswer": "string",
                  "explanation": "string", "hints": ["string"], "points": 10}}""";
            case TASK -> "{\"instruction\": \"string\", \"hints\": [\"string\"], \"successCriteria\": [\"string\"], \"solution\": \"string\"}";
            case FLASHCARD -> "{\"front\": \"string\", \"back\": \"string\", \"hint\": \"string\"}";
            case SUMMARY -> "{\"keyPoints\": [\"string\"], \"nextUp\": \"string\"}";
        };
    }

    private Outline requireOutline(Course course) {
        if (course.getOutline() == null) {
            throw new CourseStateException(CourseStateException.OUTLINE_NOT_READY,
                    "Course outline is not ready yet.");
        }
        return course.getOutline();
    }

    private String outlineTitle(Course course, Outline outline) {
        return outline.getTitle() == null || outline.getTitle().isBlank() ? course.getTitle() : outline.getTitle();
    }
}
