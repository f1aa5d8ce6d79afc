package org.example.course.controller;

import org.example.course.config.RequestContext;
import org.example.course.model.Block;
import org.example.course.model.BlockContent;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.Lesson;
import org.example.course.model.UserContext;
import org.example.course.service.LessonProgressionService;
import org.example.course.service.LessonProgressionService.BlockCompletion;
import org.example.course.service.LessonProgressionService.NextUnit;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/courses/{courseId}")
public class LessonController {

    private final LessonProgressionService lessonProgressionService;

    public LessonController(LessonProgressionService lessonProgressionService) {
        this.lessonProgressionService = lessonProgressionService;
    }

    @GetMapping("/next")
    public NextUnit next(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return lessonProgressionService.nextUnit(new UserContext(userId, tier), courseId);
    }

    @PostMapping("/next/materialize")
    public ResponseEntity<GeneratedUnit> materializeNext(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return lessonProgressionService.materializeNext(new UserContext(userId, tier), courseId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/sections/{sectionId}/lessons/{lessonId}")
    public Lesson getLesson(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String sectionId,
            @PathVariable String lessonId) {
        return lessonProgressionService.getLesson(new UserContext(userId, tier), courseId, sectionId, lessonId);
    }

    @PostMapping("/sections/{sectionId}/lessons/{lessonId}/blocks")
    public List<Block> generateBlocks(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String sectionId,
            @PathVariable String lessonId) {
        return lessonProgressionService.generateLessonBlocks(
                new UserContext(userId, tier), courseId, sectionId, lessonId);
    }

    @PostMapping("/sections/{sectionId}/lessons/{lessonId}/blocks/{blockId}/content")
    public BlockContent generateBlockContent(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String sectionId,
            @PathVariable String lessonId,
            @PathVariable String blockId) {
        return lessonProgressionService.generateBlockContent(
                new UserContext(userId, tier), courseId, sectionId, lessonId, blockId);
    }

    @PostMapping("/sections/{sectionId}/lessons/{lessonId}/blocks/{blockId}/complete")
    public BlockCompletion completeBlock(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String sectionId,
            @PathVariable String lessonId,
            @PathVariable String blockId,
            @RequestBody(required = false) CompleteBlockRequest request) {
        CompleteBlockRequest body = request == null ? new CompleteBlockRequest(null, null, null, 0) : request;
        return lessonProgressionService.completeBlock(new UserContext(userId, tier), courseId, sectionId, lessonId,
                blockId, body.userAnswer(), body.isCorrect(), body.score(), body.timeSpent());
    }

    public record CompleteBlockRequest(String userAnswer, Boolean isCorrect, Double score, int timeSpent) {
    }
}
