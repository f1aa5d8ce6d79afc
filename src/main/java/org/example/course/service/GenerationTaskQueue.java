package org.example.course.service;

import org.example.course.model.GenerationWork;

import java.util.Map;

/**
 * Durable at-least-once queue for background generation. Retry and backoff belong to the queue.
 */
public interface GenerationTaskQueue {

    /**
     * Stores the work for later execution and returns its handle.
     *
     * @throws org.springframework.dao.DataAccessException if the work could not be stored
     */
    String submit(GenerationWork work);

    boolean isAvailable();

    Map<String, Long> statusCounts();
}
