package org.neuralchilli.flotilla.quota;

import java.util.List;

/**
 * Outcome of asking the ledger to reserve capacity for a group.
 */
public sealed interface AdmissionDecision {

    boolean isAdmitted();

    /**
     * Capacity reserved. {@code preempted} lists the borrower reservations that were
     * revoked in the same step to make room; empty when nothing was reclaimed.
     */
    record Admitted(Reservation reservation, List<Reservation> preempted) implements AdmissionDecision {

        public Admitted {
            preempted = preempted == null ? List.of() : List.copyOf(preempted);
        }

        @Override
        public boolean isAdmitted() {
            return true;
        }
    }

    /**
     * Nothing reserved; the group stays queued.
     */
    record Blocked(String reason) implements AdmissionDecision {
        @Override
        public boolean isAdmitted() {
            return false;
        }
    }

    static AdmissionDecision admitted(Reservation reservation, List<Reservation> preempted) {
        return new Admitted(reservation, preempted);
    }

    static AdmissionDecision blocked(String reason) {
        return new Blocked(reason);
    }
}
