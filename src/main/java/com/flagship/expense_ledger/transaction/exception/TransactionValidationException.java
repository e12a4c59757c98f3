package com.flagship.expense_ledger.transaction.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a transaction draft breaks one or more ledger invariants.
 * Carries every violation found, not just the first.
 */
public class TransactionValidationException extends RuntimeException {

    private final List<Violation> violations;

    public TransactionValidationException(List<Violation> violations) {
        super(summarize(violations));
        this.violations = List.copyOf(violations);
    }

    public static TransactionValidationException single(String field, String message) {
        return new TransactionValidationException(List.of(new Violation(field, message)));
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Violations grouped by field; several messages for one field are joined with "; ".
     */
    public Map<String, String> asDetails() {
        return violations.stream()
            .collect(Collectors.toMap(
                Violation::field,
                Violation::message,
                (first, second) -> first + "; " + second,
                LinkedHashMap::new));
    }

    private static String summarize(List<Violation> violations) {
        return violations.size() == 1
            ? violations.get(0).field() + ": " + violations.get(0).message()
            : violations.size() + " validation errors";
    }

    public record Violation(String field, String message) {
    }
}
