package org.example.course.model;

public enum UnitKind {
    OUTLINE,
    NEXT_STEP,
    LESSON_BLOCKS,
    BLOCK_CONTENT
}
