package org.example.course.service;

import org.example.course.model.UserContext;

/**
 * Published after an outline has been stored and the cursor initialized.
 */
public record OutlineReadyEvent(String courseId, UserContext user) {
}
