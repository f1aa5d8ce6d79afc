package org.example.course.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.course.model.Block;
import org.example.course.model.BlockContent;
import org.example.course.model.BlockType;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.example.course.model.Outline;
import org.example.course.model.ProgressStatus;
import org.example.course.model.QuestionType;
import org.example.course.model.Section;
import org.example.course.model.Step;
import org.example.course.model.StepType;
import org.example.course.model.UnitKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns raw generator output into typed course units. Pure: no persistence and no clock.
 * Missing ids are filled with fresh UUIDs; free text longer than the caps is cut silently.
 */
@Component
public class ContentParser {

    public static final int MAX_TEXT_LENGTH = 10_000;
    public static final int MAX_TITLE_LENGTH = 300;
    private static final int DEFAULT_QUESTION_POINTS = 10;

    private final ObjectMapper objectMapper;

    public ContentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record CompactionSummary(
            String summary,
            List<String> strengths,
            List<String> weaknesses,
            List<String> recommendations) {
    }

    /**
     * Parses output for the given unit kind. {@code blockType} is only read for block content.
     */
    public GeneratedUnit parse(String rawText, UnitKind kind, BlockType blockType) {
        return switch (kind) {
            case OUTLINE -> new GeneratedUnit.OutlineUnit(parseOutline(rawText));
            case NEXT_STEP -> new GeneratedUnit.StepUnit(parseStep(rawText));
            case LESSON_BLOCKS -> new GeneratedUnit.LessonBlocksUnit(parseLessonBlocks(rawText));
            case BLOCK_CONTENT -> {
                if (blockType == null) {
                    throw new ValidationException("Block content requires a block type");
                }
                yield new GeneratedUnit.BlockContentUnit(parseBlockContent(rawText, blockType));
            }
        };
    }

    public Outline parseOutline(String rawText) {
        JsonNode root = readObject(rawText, "outline");
        Outline outline = new Outline();
        outline.setTitle(requiredText(root, "title", "outline", rawText, MAX_TITLE_LENGTH));
        outline.setDescription(text(root, "description", MAX_TEXT_LENGTH));
        outline.setEstimatedMinutes(root.path("estimatedMinutes").asInt(0));
        outline.setPrerequisites(stringList(root, "prerequisites"));
        outline.setLearningOutcomes(stringList(root, "learningOutcomes"));

        JsonNode metadata = root.path("metadata");
        if (metadata.isObject()) {
            outline.setMetadata(new Outline.Metadata(
                    text(metadata, "difficulty", MAX_TITLE_LENGTH),
                    text(metadata, "category", MAX_TITLE_LENGTH),
                    stringList(metadata, "tags")));
        }

        JsonNode sectionsNode = root.path("sections");
        if (!sectionsNode.isArray() || sectionsNode.isEmpty()) {
            throw new MalformedResponseException("Outline has no sections", rawText);
        }

        Set<String> usedIds = new HashSet<>();
        List<Section> sections = new ArrayList<>();
        for (JsonNode sectionNode : sectionsNode) {
            Section section = new Section(
                    uniqueId(sectionNode, usedIds),
                    requiredText(sectionNode, "title", "section", rawText, MAX_TITLE_LENGTH),
                    text(sectionNode, "description", MAX_TEXT_LENGTH));
            section.setEstimatedMinutes(sectionNode.path("estimatedMinutes").asInt(0));
            section.setLearningOutcomes(stringList(sectionNode, "learningOutcomes"));
            section.setStatus(ProgressStatus.PENDING);

            JsonNode lessonsNode = sectionNode.path("lessons");
            if (!lessonsNode.isArray() || lessonsNode.isEmpty()) {
                throw new MalformedResponseException(
                        "Section '" + section.getTitle() + "' has no lessons", rawText);
            }
            for (JsonNode lessonNode : lessonsNode) {
                Lesson lesson = new Lesson(
                        uniqueId(lessonNode, usedIds),
                        requiredText(lessonNode, "title", "lesson", rawText, MAX_TITLE_LENGTH),
                        text(lessonNode, "description", MAX_TEXT_LENGTH),
                        lessonNode.path("estimatedMinutes").asInt(0));
                lesson.setStatus(ProgressStatus.PENDING);
                lesson.setBlocksStatus(GenerationStatus.PENDING);
                section.getLessons().add(lesson);
            }
            sections.add(section);
        }
        outline.setSections(sections);
        return outline;
    }

    public Step parseStep(String rawText) {
        JsonNode root = readObject(rawText, "step");
        String typeValue = text(root, "type", MAX_TITLE_LENGTH);
        StepType type = StepType.fromValue(typeValue)
                .orElseThrow(() -> new MalformedResponseException(
                        "Unknown or missing step type: " + typeValue, rawText));

        Step step = new Step();
        step.setId(idOrFresh(root));
        step.setType(type);
        step.setTitle(requiredText(root, "title", "step", rawText, MAX_TITLE_LENGTH));
        String topic = text(root, "topic", MAX_TITLE_LENGTH);
        step.setTopic(topic == null || topic.isBlank() ? step.getTitle() : topic);
        step.setContent(text(root, "content", MAX_TEXT_LENGTH));
        step.setQuestion(text(root, "question", MAX_TEXT_LENGTH));
        step.setOptions(stringList(root, "options"));
        step.setExpectedAnswer(text(root, "expectedAnswer", MAX_TEXT_LENGTH));
        step.setTask(text(root, "task", MAX_TEXT_LENGTH));
        step.setHints(stringList(root, "hints"));

        if (type == StepType.QUIZ && isBlank(step.getQuestion())) {
            throw new MalformedResponseException("Quiz step has no question", rawText);
        }
        return step;
    }

    public List<Block> parseLessonBlocks(String rawText) {
        JsonNode root = readObject(rawText, "lesson blocks");
        JsonNode blocksNode = root.path("blocks");
        if (!blocksNode.isArray() || blocksNode.isEmpty()) {
            throw new MalformedResponseException("Lesson has no blocks", rawText);
        }

        Set<String> usedIds = new HashSet<>();
        List<Block> blocks = new ArrayList<>();
        int position = 0;
        for (JsonNode blockNode : blocksNode) {
            String typeValue = text(blockNode, "type", MAX_TITLE_LENGTH);
            BlockType type = BlockType.fromValue(typeValue)
                    .orElseThrow(() -> new MalformedResponseException(
                            "Unknown or missing block type: " + typeValue, rawText));
            int order = blockNode.hasNonNull("order") ? blockNode.get("order").asInt(position) : position;
            Block block = new Block(
                    uniqueId(blockNode, usedIds),
                    type,
                    text(blockNode, "title", MAX_TITLE_LENGTH),
                    text(blockNode, "purpose", MAX_TEXT_LENGTH),
                    order);
            block.setContentStatus(GenerationStatus.PENDING);
            blocks.add(block);
            position++;
        }
        return blocks;
    }

    public BlockContent parseBlockContent(String rawText, BlockType type) {
        JsonNode root = readObject(rawText, type.value() + " content");
        JsonNode node = root.path("content").isObject() ? root.path("content") : root;

        return switch (type) {
            case TEXT -> {
                String markdown = text(node, "markdown", MAX_TEXT_LENGTH);
                if (isBlank(markdown)) {
                    markdown = requiredText(node, "text", "text block", rawText, MAX_TEXT_LENGTH);
                }
                yield new BlockContent.Text(markdown);
            }
            case CODE -> {
                String language = text(node, "language", MAX_TITLE_LENGTH);
                yield new BlockContent.Code(
                        isBlank(language) ? "plaintext" : language,
                        requiredText(node, "code", "code block", rawText, MAX_TEXT_LENGTH),
                        text(node, "explanation", MAX_TEXT_LENGTH),
                        node.path("runnable").asBoolean(false));
            }
            case QUESTION -> new BlockContent.QuestionBlock(parseQuestion(node, rawText));
            case TASK -> new BlockContent.Task(
                    requiredText(node, "instruction", "task block", rawText, MAX_TEXT_LENGTH),
                    stringList(node, "hints"),
                    stringList(node, "successCriteria"),
                    text(node, "solution", MAX_TEXT_LENGTH));
            case FLASHCARD -> new BlockContent.Flashcard(
                    requiredText(node, "front", "flashcard block", rawText, MAX_TEXT_LENGTH),
                    requiredText(node, "back", "flashcard block", rawText, MAX_TEXT_LENGTH),
                    text(node, "hint", MAX_TEXT_LENGTH));
            case SUMMARY -> {
                List<String> keyPoints = stringList(node, "keyPoints");
                if (keyPoints.isEmpty()) {
                    throw new MalformedResponseException("Summary block has no key points", rawText);
                }
                yield new BlockContent.Summary(keyPoints, text(node, "nextUp", MAX_TEXT_LENGTH));
            }
        };
    }

    public CompactionSummary parseCompaction(String rawText) {
        JsonNode root = readObject(rawText, "compaction");
        return new CompactionSummary(
                requiredText(root, "summary", "compaction", rawText, MAX_TEXT_LENGTH),
                stringList(root, "strengths"),
                stringList(root, "weaknesses"),
                stringList(root, "recommendations"));
    }

    private BlockContent.Question parseQuestion(JsonNode node, String rawText) {
        JsonNode questionNode = node.path("question").isObject() ? node.path("question") : node;
        String text = requiredText(questionNode, "text", "question block", rawText, MAX_TEXT_LENGTH);

        List<BlockContent.Question.Option> options = new ArrayList<>();
        JsonNode optionsNode = questionNode.path("options");
        if (optionsNode.isArray()) {
            int index = 0;
            for (JsonNode optionNode : optionsNode) {
                String fallbackId = String.valueOf((char) ('a' + Math.min(index, 25)));
                if (optionNode.isTextual()) {
                    options.add(new BlockContent.Question.Option(fallbackId, truncate(optionNode.asText(), MAX_TEXT_LENGTH)));
                } else if (optionNode.isObject()) {
                    String id = text(optionNode, "id", MAX_TITLE_LENGTH);
                    options.add(new BlockContent.Question.Option(
                            isBlank(id) ? fallbackId : id,
                            text(optionNode, "text", MAX_TEXT_LENGTH)));
                }
                index++;
            }
        }

        String typeValue = text(questionNode, "type", MAX_TITLE_LENGTH);
        QuestionType type = QuestionType.fromValue(typeValue)
                .orElse(options.isEmpty() ? QuestionType.SHORT_ANSWER : QuestionType.MULTIPLE_CHOICE);
        int points = questionNode.path("points").asInt(DEFAULT_QUESTION_POINTS);

        return new BlockContent.Question(
                idOrFresh(questionNode),
                text,
                type,
                options,
                text(questionNode, "correctAnswer", MAX_TEXT_LENGTH),
                text(questionNode, "explanation", MAX_TEXT_LENGTH),
                stringList(questionNode, "hints"),
                points > 0 ? points : DEFAULT_QUESTION_POINTS);
    }

    private JsonNode readObject(String rawText, String unitName) {
        String json = extractJsonObject(rawText, unitName);
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException("Response for " + unitName + " is not a JSON object", rawText);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Invalid JSON in " + unitName + " response", rawText, e);
        }
    }

    private String extractJsonObject(String text, String unitName) {
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Empty " + unitName + " response", text);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new MalformedResponseException("No JSON object found in " + unitName + " response", text);
    }

    private String requiredText(JsonNode node, String field, String unitName, String rawText, int maxLength) {
        String value = text(node, field, maxLength);
        if (isBlank(value)) {
            throw new MalformedResponseException(unitName + " is missing '" + field + "'", rawText);
        }
        return value;
    }

    private String text(JsonNode node, String field, int maxLength) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return truncate(value.asText().trim(), maxLength);
    }

    private List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull()) {
            return result;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    result.add(truncate(item.asText().trim(), MAX_TEXT_LENGTH));
                }
            }
        } else if (value.isTextual() && !value.asText().isBlank()) {
            result.add(truncate(value.asText().trim(), MAX_TEXT_LENGTH));
        }
        return result;
    }

    private String uniqueId(JsonNode node, Set<String> usedIds) {
        String id = idOrFresh(node);
        while (!usedIds.add(id)) {
            id = UUID.randomUUID().toString();
        }
        return id;
    }

    private String idOrFresh(JsonNode node) {
        String id = text(node, "id", 64);
        return isBlank(id) ? UUID.randomUUID().toString() : id;
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
