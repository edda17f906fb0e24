package com.ivamare.eventsourcing.bus;

/**
 * Handler that maintains a read model. Projectors must tolerate seeing an event more than once.
 */
public interface Projector extends EventHandler {
}
