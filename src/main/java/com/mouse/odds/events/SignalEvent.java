package com.mouse.odds.events;

/**
 * A named notification emitted by the ingestion core. Subscribers switch on the concrete type.
 */
public interface SignalEvent {

    String name();
}
