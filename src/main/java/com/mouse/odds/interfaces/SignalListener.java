package com.mouse.odds.interfaces;

import com.mouse.odds.events.SignalEvent;

@FunctionalInterface
public interface SignalListener {

    void onSignal(SignalEvent event);
}
