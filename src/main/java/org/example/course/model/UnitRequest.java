package org.example.course.model;

/**
 * Identifies one generatable unit of a course. Which references are set depends on the kind:
 * a step request carries the index the step will get, lesson and block requests carry ids.
 */
public record UnitRequest(
        UnitKind kind,
        Integer stepIndex,
        String sectionId,
        String lessonId,
        String blockId) {

    public static UnitRequest outline() {
        return new UnitRequest(UnitKind.OUTLINE, null, null, null, null);
    }

    public static UnitRequest nextStep(int stepIndex) {
        return new UnitRequest(UnitKind.NEXT_STEP, stepIndex, null, null, null);
    }

    public static UnitRequest lessonBlocks(String sectionId, String lessonId) {
        return new UnitRequest(UnitKind.LESSON_BLOCKS, null, sectionId, lessonId, null);
    }

    public static UnitRequest blockContent(String sectionId, String lessonId, String blockId) {
        return new UnitRequest(UnitKind.BLOCK_CONTENT, null, sectionId, lessonId, blockId);
    }

    public String cacheKey(String courseId) {
        return switch (kind) {
            case OUTLINE -> courseId + ":outline";
            case NEXT_STEP -> courseId + ":step:" + stepIndex;
            case LESSON_BLOCKS -> courseId + ":blocks:" + lessonId;
            case BLOCK_CONTENT -> courseId + ":content:" + lessonId + ":" + blockId;
        };
    }
}
