package org.example.course.model;

import java.util.List;

/**
 * Typed result of parsing generator output for one unit kind.
 */
public interface GeneratedUnit {

    UnitKind kind();

    record OutlineUnit(Outline outline) implements GeneratedUnit {
        @Override
        public UnitKind kind() {
            return UnitKind.OUTLINE;
        }
    }

    record StepUnit(Step step) implements GeneratedUnit {
        @Override
        public UnitKind kind() {
            return UnitKind.NEXT_STEP;
        }
    }

    record LessonBlocksUnit(List<Block> blocks) implements GeneratedUnit {
        @Override
        public UnitKind kind() {
            return UnitKind.LESSON_BLOCKS;
        }
    }

    record BlockContentUnit(BlockContent content) implements GeneratedUnit {
        @Override
        public UnitKind kind() {
            return UnitKind.BLOCK_CONTENT;
        }
    }
}
