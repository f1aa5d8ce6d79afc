package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.Block;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.example.course.model.Outline;
import org.example.course.model.Section;
import org.example.course.model.Step;
import org.example.course.model.StepType;

final class CourseFixtures {

    private CourseFixtures() {
    }

    /**
     * Outline with {@code lessonsPerSection[i]} lessons in section i. Ids are "s{i}" and "s{i}-l{j}".
     */
    static Outline outline(int... lessonsPerSection) {
        Outline outline = new Outline();
        outline.setTitle("Learn Rust");
        for (int i = 0; i < lessonsPerSection.length; i++) {
            Section section = new Section("s" + i, "Section " + i, null);
            for (int j = 0; j < lessonsPerSection[i]; j++) {
                section.getLessons().add(new Lesson("s" + i + "-l" + j, "Lesson " + i + "." + j, null, 10));
            }
            outline.getSections().add(section);
        }
        return outline;
    }

    static Course course(ProgressionMode mode) {
        Course course = new Course();
        course.setId("course-1");
        course.setUserId("user-1");
        course.setTitle("Learn Rust");
        course.setStatus(CourseStatus.ACTIVE);
        course.setOutlineStatus(OutlineStatus.GENERATING);
        course.setProgressionMode(mode);
        return course;
    }

    static Course courseWithOutline(ProgressionMode mode, int... lessonsPerSection) {
        Course course = course(mode);
        Outline outline = outline(lessonsPerSection);
        course.setOutline(outline);
        course.setOutlineStatus(OutlineStatus.READY);
        course.setTotalLessons(outline.countLessons());
        course.setCurrentPosition(new PositionTracker().initialize(outline));
        return course;
    }

    static void readyBlocks(Lesson lesson, BlockType... types) {
        lesson.getBlocks().clear();
        for (int i = 0; i < types.length; i++) {
            Block block = new Block(lesson.getId() + "-b" + i, types[i], "Block " + i, null, i);
            lesson.getBlocks().add(block);
        }
        lesson.setBlocksStatus(GenerationStatus.READY);
    }

    static Step step(int index, StepType type, String topic) {
        Step step = new Step();
        step.setId("step-" + index);
        step.setIndex(index);
        step.setType(type);
        step.setTopic(topic);
        step.setTitle("Step " + index);
        return step;
    }

    static Step completedStep(int index, StepType type, String topic, Double score) {
        Step step = step(index, type, topic);
        step.setCompleted(true);
        step.setScore(score);
        return step;
    }
}
