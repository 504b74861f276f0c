package com.mouse.odds.service;

import com.mouse.odds.events.SignalEvent;
import com.mouse.odds.interfaces.SignalListener;
import com.mouse.odds.interfaces.SignalPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans every signal out to all registered listeners on the publishing thread.
 * A failing listener is logged and skipped; the others still receive the event.
 */
@Slf4j
@Service
public class SignalListenerRegistry implements SignalPublisher {

    private final List<SignalListener> listeners = new CopyOnWriteArrayList<>();

    public SignalListenerRegistry(List<SignalListener> listeners) {
        this.listeners.addAll(listeners);
        log.info("Signal registry started with {} listener(s)", listeners.size());
    }

    public void register(SignalListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void unregister(SignalListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public void publish(SignalEvent event) {
        if (event == null) {
            return;
        }
        for (SignalListener listener : listeners) {
            try {
                listener.onSignal(event);
            } catch (Exception e) {
                log.error("Listener {} failed on {} event", listener.getClass().getSimpleName(), event.name(), e);
            }
        }
    }
}
