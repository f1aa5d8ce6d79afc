package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Payload of a block. Exactly one variant exists per {@link BlockType}; the variant must match
 * the owning block's type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockContent.Text.class, name = "text"),
        @JsonSubTypes.Type(value = BlockContent.Code.class, name = "code"),
        @JsonSubTypes.Type(value = BlockContent.QuestionBlock.class, name = "question"),
        @JsonSubTypes.Type(value = BlockContent.Task.class, name = "task"),
        @JsonSubTypes.Type(value = BlockContent.Flashcard.class, name = "flashcard"),
        @JsonSubTypes.Type(value = BlockContent.Summary.class, name = "summary")
})
public interface BlockContent {

    BlockType blockType();

    record Text(String markdown) implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.TEXT;
        }
    }

    record Code(String language, String code, String explanation, boolean runnable) implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.CODE;
        }
    }

    record QuestionBlock(Question question) implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.QUESTION;
        }
    }

    record Task(String instruction, List<String> hints, List<String> successCriteria, String solution)
            implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.TASK;
        }
    }

    record Flashcard(String front, String back, String hint) implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.FLASHCARD;
        }
    }

    record Summary(List<String> keyPoints, String nextUp) implements BlockContent {
        @Override
        public BlockType blockType() {
            return BlockType.SUMMARY;
        }
    }

    record Question(
            String id,
            String text,
            QuestionType type,
            List<Option> options,
            String correctAnswer,
            String explanation,
            List<String> hints,
            int points) {

        public record Option(String id, String text) {
        }
    }
}
