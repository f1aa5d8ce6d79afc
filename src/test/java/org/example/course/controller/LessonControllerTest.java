package org.example.course.controller;

import org.example.course.model.BlockContent;
import org.example.course.model.BlockResult;
import org.example.course.model.BlockType;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.service.CourseStateException;
import org.example.course.service.GenerationException;
import org.example.course.service.LessonProgressionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LessonController.class)
class LessonControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LessonProgressionService lessonProgressionService;

    @Test
    void next_reportsPositionAndPendingUnit() throws Exception {
        Lesson lesson = new Lesson("s0-l0", "Ownership", "Moves and copies", 15);
        when(lessonProgressionService.nextUnit(any(UserContext.class), eq("course-1")))
                .thenReturn(new LessonProgressionService.NextUnit(new LessonPosition(0, 0, "s0", "s0-l0"),
                        lesson, UnitRequest.lessonBlocks("s0", "s0-l0"), false));

        mockMvc.perform(get("/api/courses/course-1/next").header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position.sectionId", is("s0")))
                .andExpect(jsonPath("$.position.lessonIndex", is(0)))
                .andExpect(jsonPath("$.lesson.title", is("Ownership")))
                .andExpect(jsonPath("$.outlineFinished", is(false)));
    }

    @Test
    void next_outlineStillGeneratingReturnsConflict() throws Exception {
        when(lessonProgressionService.nextUnit(any(UserContext.class), eq("course-1")))
                .thenThrow(new CourseStateException(CourseStateException.OUTLINE_NOT_READY,
                        "Course outline is not ready"));

        mockMvc.perform(get("/api/courses/course-1/next").header("X-User-Id", "user-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("OUTLINE_NOT_READY")));
    }

    @Test
    void materialize_nothingPendingReturnsNoContent() throws Exception {
        when(lessonProgressionService.materializeNext(any(UserContext.class), eq("course-1")))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/courses/course-1/next/materialize").header("X-User-Id", "user-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void blockContent_returnsTaggedContent() throws Exception {
        when(lessonProgressionService.generateBlockContent(
                any(UserContext.class), eq("course-1"), eq("s0"), eq("s0-l0"), eq("b1")))
                .thenReturn(new BlockContent.Text("A value has exactly one owner."));

        mockMvc.perform(post("/api/courses/course-1/sections/s0/lessons/s0-l0/blocks/b1/content")
                        .header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind", is("text")))
                .andExpect(jsonPath("$.markdown", is("A value has exactly one owner.")));
    }

    @Test
    void blockContent_upstreamFailureReturnsBadGateway() throws Exception {
        when(lessonProgressionService.generateBlockContent(
                any(UserContext.class), eq("course-1"), eq("s0"), eq("s0-l0"), eq("b1")))
                .thenThrow(new GenerationException(GenerationException.Cause.UPSTREAM, "Provider unavailable"));

        mockMvc.perform(post("/api/courses/course-1/sections/s0/lessons/s0-l0/blocks/b1/content")
                        .header("X-User-Id", "user-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code", is("GENERATION_FAILED")))
                .andExpect(jsonPath("$.cause", is("UPSTREAM")));
    }

    @Test
    void blockContent_timeoutReturnsGatewayTimeout() throws Exception {
        when(lessonProgressionService.generateBlockContent(
                any(UserContext.class), eq("course-1"), eq("s0"), eq("s0-l0"), eq("b1")))
                .thenThrow(new GenerationException(GenerationException.Cause.TIMEOUT, "Generation timed out"));

        mockMvc.perform(post("/api/courses/course-1/sections/s0/lessons/s0-l0/blocks/b1/content")
                        .header("X-User-Id", "user-1"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void completeBlock_returnsLessonAndCourseProgress() throws Exception {
        BlockResult result = new BlockResult("b2", BlockType.QUESTION, true,
                Instant.parse("2026-03-01T10:00:00Z"), "c", true, 100, 1, 40);
        when(lessonProgressionService.completeBlock(any(UserContext.class), eq("course-1"), eq("s0"),
                eq("s0-l0"), eq("b2"), eq("c"), eq(true), isNull(), eq(40)))
                .thenReturn(new LessonProgressionService.BlockCompletion(result, true, 100,
                        new LessonPosition(0, 1, "s0", "s0-l1"), 25, 1, false));

        mockMvc.perform(post("/api/courses/course-1/sections/s0/lessons/s0-l0/blocks/b2/complete")
                        .header("X-User-Id", "user-1")
                        .contentType("application/json")
                        .content("""
                                {"userAnswer":"c","isCorrect":true,"timeSpent":40}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lessonCompleted", is(true)))
                .andExpect(jsonPath("$.position.lessonId", is("s0-l1")))
                .andExpect(jsonPath("$.progress", is(25)))
                .andExpect(jsonPath("$.result.attempts", is(1)));
    }
}
