package org.example.course.controller;

import org.example.course.config.RequestContext;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.TopicMemory;
import org.example.course.model.UserContext;
import org.example.course.service.CourseService;
import org.example.course.service.UsageLimiter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/courses")
public class CourseController {

    private final CourseService courseService;
    private final UsageLimiter usageLimiter;

    public CourseController(CourseService courseService, UsageLimiter usageLimiter) {
        this.courseService = courseService;
        this.usageLimiter = usageLimiter;
    }

    @PostMapping
    public ResponseEntity<Course> create(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @RequestBody CreateCourseRequest request) {
        Course course = courseService.create(
                new UserContext(userId, tier), request.title(), request.emoji(), request.progressionMode());
        return ResponseEntity.status(HttpStatus.CREATED).body(course);
    }

    @GetMapping
    public List<Course> list(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier) {
        return courseService.list(new UserContext(userId, tier));
    }

    @GetMapping("/usage")
    public Map<String, Object> usage(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier) {
        return usageLimiter.usageSnapshot(new UserContext(userId, tier));
    }

    @GetMapping("/{courseId}")
    public Course get(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return courseService.get(new UserContext(userId, tier), courseId);
    }

    @PatchMapping("/{courseId}")
    public Course rename(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @RequestBody RenameCourseRequest request) {
        return courseService.rename(new UserContext(userId, tier), courseId, request.title(), request.emoji());
    }

    @PostMapping("/{courseId}/outline/retry")
    public ResponseEntity<Course> retryOutline(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return ResponseEntity.accepted().body(courseService.retryOutline(new UserContext(userId, tier), courseId));
    }

    @PostMapping("/{courseId}/archive")
    public Course archive(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return courseService.archive(new UserContext(userId, tier), courseId);
    }

    @PostMapping("/{courseId}/unarchive")
    public Course unarchive(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        return courseService.unarchive(new UserContext(userId, tier), courseId);
    }

    @DeleteMapping("/{courseId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId) {
        courseService.delete(new UserContext(userId, tier), courseId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{courseId}/memory/topics/{topic}")
    public TopicMemory updateTopicMemory(
            @RequestHeader(RequestContext.USER_ID_HEADER) String userId,
            @RequestHeader(value = RequestContext.USER_TIER_HEADER, required = false) String tier,
            @PathVariable String courseId,
            @PathVariable String topic,
            @RequestBody TopicMemoryRequest request) {
        return courseService.updateTopicMemory(
                new UserContext(userId, tier), courseId, topic, request.confidence(), request.timesTested());
    }

    public record CreateCourseRequest(String title, String emoji, ProgressionMode progressionMode) {
    }

    public record RenameCourseRequest(String title, String emoji) {
    }

    public record TopicMemoryRequest(double confidence, int timesTested) {
    }
}
