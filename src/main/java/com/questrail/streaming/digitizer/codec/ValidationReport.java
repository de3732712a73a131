package com.questrail.streaming.digitizer.codec;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating a message independently of encoding.
 *
 * <p>A report is valid when it carries no {@link Violation.Severity#ERROR}
 * violations. Warnings do not block encoding.</p>
 */
public record ValidationReport(List<Violation> violations)
{
    private static final ValidationReport OK = new ValidationReport(List.of());

    public ValidationReport {
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
    }

    public static ValidationReport ok() {
        return OK;
    }

    public static ValidationReport of(List<Violation> violations) {
        return violations.isEmpty() ? OK : new ValidationReport(violations);
    }

    public boolean isValid() {
        return errors().isEmpty();
    }

    public boolean hasWarnings() {
        return violations.stream().anyMatch(v -> v.severity() == Violation.Severity.WARNING);
    }

    public List<Violation> errors() {
        return violations.stream()
                .filter(v -> v.severity() == Violation.Severity.ERROR)
                .toList();
    }

    public boolean contains(Violation.Code code) {
        return violations.stream().anyMatch(v -> v.code() == code);
    }
}
