package com.trackflow.dto;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating one record. Built fresh on every call and never stored.
 */
public record ValidationVerdict(boolean valid, List<ValidationCheck> checks, List<String> warnings) {

    public static ValidationVerdict of(List<ValidationCheck> checks, List<String> warnings) {
        boolean valid = checks.stream()
                .filter(ValidationCheck::counts)
                .allMatch(ValidationCheck::passed);
        return new ValidationVerdict(valid, List.copyOf(checks), List.copyOf(warnings));
    }

    public Optional<ValidationCheck> check(String name) {
        return checks.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<String> failedChecks() {
        return checks.stream()
                .filter(ValidationCheck::counts)
                .filter(c -> !c.passed())
                .map(ValidationCheck::name)
                .toList();
    }
}
