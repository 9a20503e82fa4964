package org.neuralchilli.flotilla.quota;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.Priority;

/**
 * Revocable borrowed-from edge: capacity a LOW reservation took from a sibling pool's
 * idle quota of one priority class.
 */
public record Loan(String lenderPool, Priority lenderClass, Capacity amount) {

    public Loan {
        if (lenderPool == null || lenderPool.isBlank()) {
            throw new IllegalArgumentException("Lender pool cannot be null or empty");
        }
        if (lenderClass == null) {
            throw new IllegalArgumentException("Lender class cannot be null");
        }
        if (amount == null || amount.isZero()) {
            throw new IllegalArgumentException("Loan amount must be positive");
        }
    }

    public boolean isFrom(String pool, Priority priority) {
        return lenderPool.equals(pool) && lenderClass == priority;
    }
}
