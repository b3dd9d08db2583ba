package com.visaflow.watcher;

/**
 * Kinds of watcher events.
 */
public enum WatcherEventType {
    /** A poll cycle completed. */
    POLL,
    /** A file not seen before was found. */
    NEW_FILE,
    /** A workflow was started for a new file. */
    WORKFLOW_STARTED,
    /** A poll cycle, or the handling of one file, failed. */
    ERROR,
    /** The watcher stopped, on request or after too many errors. */
    STOPPED
}
