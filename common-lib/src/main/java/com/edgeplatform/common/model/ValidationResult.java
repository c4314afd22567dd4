package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a validation pass. Errors reject, warnings flag, info notes are informational.
 * Valid means zero errors.
 */
public record ValidationResult(
    @JsonProperty("errors")   List<String> errors,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("info")     List<String> info
) {
    public ValidationResult {
        errors   = errors   != null ? List.copyOf(errors)   : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        info     = info     != null ? List.copyOf(info)     : List.of();
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }
}
