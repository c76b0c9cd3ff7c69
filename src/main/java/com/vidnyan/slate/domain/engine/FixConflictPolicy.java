package com.vidnyan.slate.domain.engine;

/**
 * What a fix pass does when it finds conflicting edits.
 */
public enum FixConflictPolicy {
    /** Apply nothing in a pass that contains any conflict. */
    SKIP_ALL,
    /** Drop only the conflicting edits and apply the rest. */
    SKIP_CONFLICTING
}
