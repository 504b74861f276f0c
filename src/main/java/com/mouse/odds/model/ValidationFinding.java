package com.mouse.odds.model;

import com.mouse.odds.enums.FindingSeverity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ValidationFinding {
    String field;
    String message;
    Object value;
    FindingSeverity severity;

    public static ValidationFinding error(String field, String message, Object value) {
        return new ValidationFinding(field, message, value, FindingSeverity.ERROR);
    }

    public static ValidationFinding warning(String field, String message, Object value) {
        return new ValidationFinding(field, message, value, FindingSeverity.WARNING);
    }

    public boolean isError() {
        return severity == FindingSeverity.ERROR;
    }

    public ValidationFinding withFieldPrefix(String prefix) {
        return toBuilder().field(prefix + field).build();
    }
}
