package com.visaflow.engine.event;

/**
 * Types of events published by the workflow engine.
 */
public enum EngineEventType {
    /** Instance created and placed on its start node. */
    STARTED,
    /** Instance moved from one node to another. */
    ADVANCED,
    /** A reviewer's decision was recorded. */
    REVIEW_SUBMITTED,
    /** An automated action ran (successfully or not). */
    ACTION_EXECUTED,
    /** Instance reached an end node. */
    COMPLETED,
    /** A transition sequence failed and was rolled back. */
    ERROR
}
