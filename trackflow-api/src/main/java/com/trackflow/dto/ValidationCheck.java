package com.trackflow.dto;

/**
 * One quality gate result. A bypassed check is reported but does not count
 * towards the verdict.
 */
public record ValidationCheck(String name, boolean passed, String detail, boolean bypassed) {

    public static ValidationCheck pass(String name, String detail) {
        return new ValidationCheck(name, true, detail, false);
    }

    public static ValidationCheck fail(String name, String detail) {
        return new ValidationCheck(name, false, detail, false);
    }

    public ValidationCheck asBypassed() {
        return new ValidationCheck(name, passed, detail, true);
    }

    public boolean counts() {
        return !bypassed;
    }
}
