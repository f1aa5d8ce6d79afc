package org.example.course.controller;

import org.example.course.service.AsyncTaskDispatcher;
import org.example.course.service.GenerationMetricsService;
import org.example.course.service.PregenerationCache;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/generation")
public class GenerationStatusController {

    private final GenerationMetricsService metricsService;
    private final PregenerationCache pregenerationCache;
    private final AsyncTaskDispatcher dispatcher;

    public GenerationStatusController(
            GenerationMetricsService metricsService,
            PregenerationCache pregenerationCache,
            AsyncTaskDispatcher dispatcher) {
        this.metricsService = metricsService;
        this.pregenerationCache = pregenerationCache;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("metrics", metricsService.snapshot());
        status.put("cacheSize", pregenerationCache.size());
        status.put("dispatch", dispatcher.stateCounts());
        status.put("queueAvailable", dispatcher.isQueueAvailable());
        status.put("queue", dispatcher.queueStatusCounts());
        return status;
    }
}
