package org.example.course.model;

public enum WorkMode {
    /** Generate and store the unit on the course. */
    MATERIALIZE,
    /** Generate speculatively into the pregeneration cache. */
    PREGENERATE
}
