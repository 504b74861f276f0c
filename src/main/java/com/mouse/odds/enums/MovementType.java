package com.mouse.odds.enums;

/**
 * Classification of a moneyline move between two snapshots of the same (fight, bookmaker).
 */
public enum MovementType {
    STEAM,        // Both sides moved the same way by at least the steam threshold
    REVERSE,      // Sides moved in opposite directions
    SIGNIFICANT,  // Above the alert threshold, neither steam nor reverse
    MINOR;        // Below the alert threshold, never alerted

    public boolean isAlertable() {
        return this != MINOR;
    }
}
