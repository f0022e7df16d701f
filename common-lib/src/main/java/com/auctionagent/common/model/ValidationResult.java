package com.auctionagent.common.model;

import java.util.List;

/**
 * Tiered validation outcome. {@code errors} block the proposal; {@code warnings} are advisory.
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors   = errors   == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult rejected(String error) {
        return new ValidationResult(List.of(error), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /** Errors first, then warnings, joined with {@code "; "}. Empty when clean. */
    public String message() {
        StringBuilder sb = new StringBuilder();
        if (!errors.isEmpty()) {
            sb.append("REJECTED: ").append(String.join("; ", errors));
        }
        if (!warnings.isEmpty()) {
            if (sb.length() > 0) sb.append(" | ");
            sb.append("WARNINGS: ").append(String.join("; ", warnings));
        }
        return sb.toString();
    }
}
