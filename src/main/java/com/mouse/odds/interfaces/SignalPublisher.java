package com.mouse.odds.interfaces;

import com.mouse.odds.events.SignalEvent;

/**
 * Outbound notification channel. The core publishes here and never knows who listens.
 */
public interface SignalPublisher {

    void publish(SignalEvent event);
}
