package org.example.course.controller;

import org.example.course.model.Step;
import org.example.course.model.StepType;
import org.example.course.model.UserContext;
import org.example.course.service.CourseStateException;
import org.example.course.service.StepProgressionService;
import org.example.course.service.UsageLimitExceededException;
import org.example.course.service.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StepController.class)
class StepControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StepProgressionService stepProgressionService;

    private static Step quizStep() {
        Step step = new Step();
        step.setId("step-3");
        step.setIndex(3);
        step.setType(StepType.QUIZ);
        step.setTitle("Check: borrowing");
        step.setTopic("borrowing");
        return step;
    }

    @Test
    void next_returnsStep() throws Exception {
        when(stepProgressionService.nextStep(new UserContext("user-1", "free"), "course-1")).thenReturn(quizStep());

        mockMvc.perform(post("/api/courses/course-1/steps/next").header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", is("step-3")))
                .andExpect(jsonPath("$.type", is("quiz")))
                .andExpect(jsonPath("$.topic", is("borrowing")));
    }

    @Test
    void next_dailyLimitReturnsForbidden() throws Exception {
        when(stepProgressionService.nextStep(any(UserContext.class), eq("course-1")))
                .thenThrow(new UsageLimitExceededException(UsageLimitExceededException.DAILY_STEP_LIMIT_REACHED,
                        "Daily step limit reached (100 on the free plan).", "free", 100, 100, true));

        mockMvc.perform(post("/api/courses/course-1/steps/next").header("X-User-Id", "user-1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code", is("DAILY_STEP_LIMIT_REACHED")))
                .andExpect(jsonPath("$.canUpgrade", is(true)));
    }

    @Test
    void next_archivedCourseReturnsConflict() throws Exception {
        when(stepProgressionService.nextStep(any(UserContext.class), eq("course-1")))
                .thenThrow(CourseStateException.archived());

        mockMvc.perform(post("/api/courses/course-1/steps/next").header("X-User-Id", "user-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("COURSE_ARCHIVED")));
    }

    @Test
    void get_unknownStepReturnsBadRequest() throws Exception {
        when(stepProgressionService.getStep(any(UserContext.class), eq("course-1"), eq("nope")))
                .thenThrow(new ValidationException("Unknown step nope in course course-1"));

        mockMvc.perform(get("/api/courses/course-1/steps/nope").header("X-User-Id", "user-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Unknown step nope in course course-1")));
    }

    @Test
    void complete_passesAnswerAndScore() throws Exception {
        Step step = quizStep();
        step.setCompleted(true);
        step.setScore(80.0);
        when(stepProgressionService.completeStep(any(UserContext.class), eq("course-1"), eq("step-3"),
                eq("b"), eq(80.0)))
                .thenReturn(new StepProgressionService.StepCompletion(step, 40, 2, false));

        mockMvc.perform(post("/api/courses/course-1/steps/step-3/complete")
                        .header("X-User-Id", "user-1")
                        .contentType("application/json")
                        .content("""
                                {"answer":"b","score":80}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress", is(40)))
                .andExpect(jsonPath("$.lessonsCompleted", is(2)))
                .andExpect(jsonPath("$.courseComplete", is(false)))
                .andExpect(jsonPath("$.step.completed", is(true)));
    }

    @Test
    void complete_withoutBodyCompletesUnscored() throws Exception {
        Step step = quizStep();
        when(stepProgressionService.completeStep(any(UserContext.class), eq("course-1"), eq("step-3"),
                isNull(), isNull()))
                .thenReturn(new StepProgressionService.StepCompletion(step, 10, 1, false));

        mockMvc.perform(post("/api/courses/course-1/steps/step-3/complete").header("X-User-Id", "user-1"))
                .andExpect(status().isOk());

        verify(stepProgressionService).completeStep(new UserContext("user-1", null), "course-1", "step-3",
                null, null);
    }
}
