package org.neuralchilli.flotilla.quota;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.Priority;

import java.util.List;

/**
 * Capacity held by one admitted group: a part from its own pool's quota for its
 * priority and, for LOW groups, loans from sibling pools.
 *
 * @param admissionSequence  ledger-wide admission order, later admissions are preempted first
 * @param submissionSequence order of the workflow's submission, the last tie-break
 */
public record Reservation(
        GroupKey group,
        String pool,
        Priority priority,
        Capacity own,
        List<Loan> loans,
        long admissionSequence,
        long submissionSequence
) {

    public Reservation {
        if (group == null) {
            throw new IllegalArgumentException("Group cannot be null");
        }
        if (pool == null || pool.isBlank()) {
            throw new IllegalArgumentException("Pool cannot be null or empty");
        }
        if (priority == null) {
            throw new IllegalArgumentException("Priority cannot be null");
        }
        if (own == null) {
            own = Capacity.ZERO;
        }
        loans = loans == null ? List.of() : List.copyOf(loans);
        if (!loans.isEmpty() && !priority.mayBorrow()) {
            throw new IllegalArgumentException(priority + " reservations never borrow");
        }
    }

    public boolean isBorrowing() {
        return !loans.isEmpty();
    }

    public Capacity borrowed() {
        Capacity total = Capacity.ZERO;
        for (Loan loan : loans) {
            total = total.plus(loan.amount());
        }
        return total;
    }

    public Capacity total() {
        return own.plus(borrowed());
    }

    /**
     * Capacity this reservation holds from one lender pool and class.
     */
    public Capacity borrowedFrom(String lenderPool, Priority lenderClass) {
        Capacity total = Capacity.ZERO;
        for (Loan loan : loans) {
            if (loan.isFrom(lenderPool, lenderClass)) {
                total = total.plus(loan.amount());
            }
        }
        return total;
    }
}
