package com.ivamare.eventsourcing.model;

/**
 * Result of applying a command to an aggregate.
 */
public enum CommandOutcome {
    /** The command was enacted and its events are pending. */
    APPLIED,
    /** A command with the same etag was already applied; nothing changed. */
    NOT_MODIFIED
}
