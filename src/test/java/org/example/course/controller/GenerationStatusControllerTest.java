package org.example.course.controller;

import org.example.course.service.AsyncTaskDispatcher;
import org.example.course.service.GenerationMetricsService;
import org.example.course.service.PregenerationCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GenerationStatusController.class)
class GenerationStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GenerationMetricsService metricsService;

    @MockitoBean
    private PregenerationCache pregenerationCache;

    @MockitoBean
    private AsyncTaskDispatcher dispatcher;

    @Test
    void status_combinesMetricsCacheAndDispatch() throws Exception {
        Map<AsyncTaskDispatcher.DispatchState, Long> states = new EnumMap<>(AsyncTaskDispatcher.DispatchState.class);
        states.put(AsyncTaskDispatcher.DispatchState.DONE, 4L);
        states.put(AsyncTaskDispatcher.DispatchState.DROPPED, 1L);
        when(metricsService.snapshot()).thenReturn(Map.of("outlineCompleted", 3L, "cacheHits", 7L));
        when(pregenerationCache.size()).thenReturn(2);
        when(dispatcher.stateCounts()).thenReturn(states);
        when(dispatcher.isQueueAvailable()).thenReturn(false);
        when(dispatcher.queueStatusCounts()).thenReturn(Map.of());

        mockMvc.perform(get("/api/generation/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.outlineCompleted", is(3)))
                .andExpect(jsonPath("$.metrics.cacheHits", is(7)))
                .andExpect(jsonPath("$.cacheSize", is(2)))
                .andExpect(jsonPath("$.dispatch.DONE", is(4)))
                .andExpect(jsonPath("$.dispatch.DROPPED", is(1)))
                .andExpect(jsonPath("$.queueAvailable", is(false)));
    }
}
