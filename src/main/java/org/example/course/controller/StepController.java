package org.example.course.controller;

import org.example.course.config.RequestContext;
import org.example.course.model.Step;
import org.example.course.model.UserContext;
import org.example.course.service.StepProgressionService;
import org.example.course.service.StepProgressionService.StepCompletion;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/courses/{courseId}/steps")
public class StepController {

    private final StepProgressionService stepProgressionService;

    public StepController(StepProgressionService stepProgressionService) {
        this.stepProgressionService = stepProgressionService;
    }

    @PostMapping("/next")
    public Step next(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return stepProgressionService.nextStep(new UserContext(userId, tier), courseId);
    }

    @GetMapping("/{stepId}")
    public Step get(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String stepId) {
        return stepProgressionService.getStep(new UserContext(userId, tier), courseId, stepId);
    }

    @PostMapping("/{stepId}/complete")
    public StepCompletion complete(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String stepId,
            @RequestBody(required = false) CompleteStepRequest request) {
        CompleteStepRequest body = request == null ? new CompleteStepRequest(null, null) : request;
        return stepProgressionService.completeStep(
                new UserContext(userId, tier), courseId, stepId, body.answer(), body.score());
    }

    public record CompleteStepRequest(String answer, Double score) {
    }
}
