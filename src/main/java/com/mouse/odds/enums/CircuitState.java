package com.mouse.odds.enums;

public enum CircuitState {
    CLOSED,     // Calls flow normally
    OPEN,       // Calls rejected until the reset timeout elapses
    HALF_OPEN   // One trial call admitted
}
