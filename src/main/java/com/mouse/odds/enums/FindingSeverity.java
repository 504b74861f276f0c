package com.mouse.odds.enums;

public enum FindingSeverity {
    WARNING,
    ERROR
}
