package com.ivamare.eventsourcing.bus;

/**
 * Handler that triggers side effects or further commands in reaction to events.
 */
public interface Consequenter extends EventHandler {
}
