package org.neuralchilli.flotilla.quota;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.PoolStatus;
import org.neuralchilli.flotilla.domain.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Quota and borrowing ledger with the preemption engine.
 * <p>
 * Each pool splits its share of a backend into per-priority quotas. HIGH and NORMAL
 * groups run on their own class quota only. LOW groups use their pool's LOW quota first
 * and borrow any shortfall from idle quota of sibling pools on the same backend. When a
 * HIGH or NORMAL group fits its quota but the capacity is lent out, the borrowers are
 * revoked in the same locked step that reserves the group.
 * <p>
 * Each pool has its own lock. Operations that touch sibling pools lock every pool of
 * the backend in name order.
 */
@ApplicationScoped
public class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private static final Comparator<Capacity> BY_SIZE =
            Comparator.comparingInt(Capacity::gpu).thenComparingInt(Capacity::cpu);

    /**
     * Lender classes in the order idle quota is borrowed from.
     */
    private static final List<Priority> LENDING_ORDER = List.of(Priority.LOW, Priority.NORMAL, Priority.HIGH);

    private final Map<String, PoolLedger> pools = new ConcurrentHashMap<>();
    private final Map<GroupKey, Reservation> reservations = new ConcurrentHashMap<>();
    private final AtomicLong admissions = new AtomicLong();

    /**
     * Install or update pool definitions. Usage of existing pools is kept; pools missing
     * from the new set are taken offline so their running groups can drain.
     */
    public void configure(Collection<Pool> definitions) {
        Set<String> names = new HashSet<>();
        for (Pool pool : definitions) {
            names.add(pool.name());
            PoolLedger existing = pools.get(pool.name());
            if (existing == null) {
                pools.put(pool.name(), new PoolLedger(pool));
                log.info("Registered pool {} on backend {} with quota {}", pool.name(), pool.backend(), pool.quota());
            } else {
                existing.lock().lock();
                try {
                    existing.redefine(pool);
                } finally {
                    existing.lock().unlock();
                }
                log.info("Updated pool {}: status {}, quota {}", pool.name(), pool.status(), pool.quota());
            }
        }

        for (PoolLedger ledger : pools.values()) {
            if (names.contains(ledger.name())) {
                continue;
            }
            ledger.lock().lock();
            try {
                if (ledger.definition().isOnline()) {
                    log.warn("Pool {} is no longer configured, taking it offline", ledger.name());
                    ledger.redefine(ledger.definition().withStatus(PoolStatus.OFFLINE));
                }
            } finally {
                ledger.lock().unlock();
            }
        }
    }

    public Optional<Pool> pool(String name) {
        PoolLedger ledger = pools.get(name);
        return ledger == null ? Optional.empty() : Optional.of(ledger.definition());
    }

    public List<Pool> pools() {
        return pools.values().stream()
                .map(PoolLedger::definition)
                .sorted(Comparator.comparing(Pool::name))
                .collect(Collectors.toList());
    }

    /**
     * Other pools bound to the same backend, by name.
     */
    public List<Pool> siblings(String poolName) {
        PoolLedger home = ledger(poolName);
        return backendScope(home).stream()
                .filter(ledger -> ledger != home)
                .map(PoolLedger::definition)
                .collect(Collectors.toList());
    }

    /**
     * Whether a group with this demand could ever be admitted to the pool, given its
     * configuration alone. Used to reject submissions that would wait forever.
     */
    public boolean isStaticallyFeasible(String poolName, Priority priority, Capacity demand) {
        PoolLedger home = ledger(poolName);
        if (!priority.mayBorrow()) {
            return demand.fitsWithin(home.quota(priority));
        }
        Capacity reachable = home.quota(Priority.LOW);
        for (Pool sibling : siblings(poolName)) {
            reachable = reachable.plus(sibling.totalQuota());
        }
        return demand.fitsWithin(reachable);
    }

    /**
     * Whether the demand can be admitted right now without reclaiming anything.
     */
    public boolean canAdmit(String poolName, Priority priority, Capacity demand) {
        PoolLedger home = ledger(poolName);
        List<PoolLedger> scope = priority.mayBorrow() ? backendScope(home) : List.of(home);
        lockAll(scope);
        try {
            if (!priority.mayBorrow()) {
                return home.withinQuota(priority, demand) && demand.fitsWithin(home.idle(priority));
            }
            return planLoans(home, scope, demand.minus(home.idle(Priority.LOW))) != null;
        } finally {
            unlockAll(scope);
        }
    }

    /**
     * Borrower reservations that would have to be revoked to admit the demand.
     * Empty when the demand fits without reclaiming, or cannot be admitted at all.
     */
    public List<Reservation> reclaimPlan(String poolName, Priority priority, Capacity demand) {
        if (priority.mayBorrow()) {
            return List.of();
        }
        PoolLedger home = ledger(poolName);
        List<PoolLedger> scope = backendScope(home);
        lockAll(scope);
        try {
            if (!home.withinQuota(priority, demand) || demand.fitsWithin(home.idle(priority))) {
                return List.of();
            }
            return selectVictims(home, priority, demand.minus(home.idle(priority)));
        } finally {
            unlockAll(scope);
        }
    }

    /**
     * Reserve capacity for a group, revoking borrowers if a HIGH or NORMAL group needs
     * quota that is lent out.
     *
     * @throws IllegalStateException if the group already holds a reservation
     */
    public AdmissionDecision reserve(
            String poolName,
            GroupKey group,
            Priority priority,
            Capacity demand,
            long submissionSequence
    ) {
        if (reservations.containsKey(group)) {
            throw new IllegalStateException("Group " + group + " already holds a reservation");
        }
        PoolLedger home = ledger(poolName);

        if (!priority.mayBorrow()) {
            home.lock().lock();
            try {
                if (!home.withinQuota(priority, demand)) {
                    return AdmissionDecision.blocked(priority + " quota of pool " + poolName + " exhausted");
                }
                if (demand.fitsWithin(home.idle(priority))) {
                    Reservation reservation = record(home, group, priority, demand, List.of(), submissionSequence);
                    return AdmissionDecision.admitted(reservation, List.of());
                }
            } finally {
                home.lock().unlock();
            }
        }

        List<PoolLedger> scope = backendScope(home);
        lockAll(scope);
        try {
            return priority.mayBorrow()
                    ? reserveBorrowing(home, scope, group, demand, submissionSequence)
                    : reserveReclaiming(home, group, priority, demand, submissionSequence);
        } finally {
            unlockAll(scope);
        }
    }

    /**
     * Release a group's reservation and repay its loans.
     *
     * @return the released reservation, empty if the group held none
     */
    public Optional<Reservation> release(GroupKey group) {
        Reservation reservation = reservations.get(group);
        if (reservation == null) {
            return Optional.empty();
        }
        PoolLedger home = ledger(reservation.pool());
        List<PoolLedger> scope = reservation.isBorrowing() ? backendScope(home) : List.of(home);
        lockAll(scope);
        try {
            if (!reservations.remove(group, reservation)) {
                return Optional.empty();
            }
            releaseLocked(reservation);
        } finally {
            unlockAll(scope);
        }
        log.debug("Released reservation of group {} in pool {}: {}", group, reservation.pool(), reservation.total());
        return Optional.of(reservation);
    }

    public Optional<Reservation> reservation(GroupKey group) {
        return Optional.ofNullable(reservations.get(group));
    }

    public List<Reservation> reservations() {
        return new ArrayList<>(reservations.values());
    }

    public PoolUsage usage(String poolName) {
        PoolLedger ledger = ledger(poolName);
        ledger.lock().lock();
        try {
            return ledger.usage();
        } finally {
            ledger.lock().unlock();
        }
    }

    /**
     * Forget all pools and reservations.
     */
    public void reset() {
        reservations.clear();
        pools.clear();
        log.debug("Quota ledger reset");
    }

    private AdmissionDecision reserveBorrowing(
            PoolLedger home,
            List<PoolLedger> scope,
            GroupKey group,
            Capacity demand,
            long submissionSequence
    ) {
        Capacity own = demand.min(home.idle(Priority.LOW));
        Capacity shortfall = demand.minus(own);
        List<Loan> loans = planLoans(home, scope, shortfall);
        if (loans == null) {
            return AdmissionDecision.blocked("Not enough idle capacity on backend "
                    + home.definition().backend() + " for LOW demand " + demand);
        }
        Reservation reservation = record(home, group, Priority.LOW, own, loans, submissionSequence);
        if (!loans.isEmpty()) {
            log.info("Group {} borrowed {} for pool {} from {}", group, reservation.borrowed(), home.name(),
                    loans.stream().map(Loan::lenderPool).distinct().collect(Collectors.toList()));
        }
        return AdmissionDecision.admitted(reservation, List.of());
    }

    private AdmissionDecision reserveReclaiming(
            PoolLedger home,
            GroupKey group,
            Priority priority,
            Capacity demand,
            long submissionSequence
    ) {
        if (!home.withinQuota(priority, demand)) {
            return AdmissionDecision.blocked(priority + " quota of pool " + home.name() + " exhausted");
        }

        List<Reservation> victims = List.of();
        Capacity idle = home.idle(priority);
        if (!demand.fitsWithin(idle)) {
            victims = selectVictims(home, priority, demand.minus(idle));
            for (Reservation victim : victims) {
                reservations.remove(victim.group());
                releaseLocked(victim);
                log.info("Preempting group {} of pool {} to reclaim {} {} quota of pool {}",
                        victim.group(), victim.pool(), victim.borrowedFrom(home.name(), priority),
                        priority, home.name());
            }
        }

        Reservation reservation = record(home, group, priority, demand, List.of(), submissionSequence);
        return AdmissionDecision.admitted(reservation, victims);
    }

    /**
     * Cover a shortfall from idle sibling quota, or null if the backend cannot.
     */
    private List<Loan> planLoans(PoolLedger home, List<PoolLedger> scope, Capacity shortfall) {
        List<Loan> loans = new ArrayList<>();
        Capacity remaining = shortfall;
        for (PoolLedger sibling : scope) {
            if (remaining.isZero()) {
                break;
            }
            if (sibling == home || !sibling.definition().isOnline()) {
                continue;
            }
            for (Priority lenderClass : LENDING_ORDER) {
                Capacity take = remaining.min(sibling.idle(lenderClass));
                if (!take.isZero()) {
                    loans.add(new Loan(sibling.name(), lenderClass, take));
                    remaining = remaining.minus(take);
                }
                if (remaining.isZero()) {
                    break;
                }
            }
        }
        return remaining.isZero() ? loans : null;
    }

    /**
     * Borrowers of the class's quota, in revocation order: pools furthest over their own
     * quota first, then the most recent admission, then the latest submission.
     */
    private List<Reservation> selectVictims(PoolLedger home, Priority priority, Capacity need) {
        Comparator<Reservation> overage = Comparator.<Reservation, Capacity>comparing(
                reservation -> ledger(reservation.pool()).borrowedIn(), BY_SIZE);
        Comparator<Reservation> order = overage.reversed()
                .thenComparing(Comparator.comparingLong(Reservation::admissionSequence).reversed())
                .thenComparing(Comparator.comparingLong(Reservation::submissionSequence).reversed());

        List<Reservation> candidates = reservations.values().stream()
                .filter(reservation -> !reservation.borrowedFrom(home.name(), priority).isZero())
                .sorted(order)
                .collect(Collectors.toList());

        List<Reservation> victims = new ArrayList<>();
        Capacity reclaimed = Capacity.ZERO;
        for (Reservation candidate : candidates) {
            if (need.fitsWithin(reclaimed)) {
                break;
            }
            victims.add(candidate);
            reclaimed = reclaimed.plus(candidate.borrowedFrom(home.name(), priority));
        }

        if (!need.fitsWithin(reclaimed)) {
            throw new IllegalStateException("Pool " + home.name() + " lent out less " + priority +
                    " quota than it is missing: need " + need + ", reclaimable " + reclaimed);
        }
        return victims;
    }

    private Reservation record(
            PoolLedger home,
            GroupKey group,
            Priority priority,
            Capacity own,
            List<Loan> loans,
            long submissionSequence
    ) {
        Reservation reservation = new Reservation(
                group, home.name(), priority, own, loans, admissions.incrementAndGet(), submissionSequence);
        home.use(priority, own);
        for (Loan loan : loans) {
            ledger(loan.lenderPool()).lend(loan.lenderClass(), loan.amount());
        }
        home.borrow(reservation.borrowed());
        reservations.put(group, reservation);
        log.debug("Reserved {} for group {} in pool {} ({})", reservation.total(), group, home.name(), priority);
        return reservation;
    }

    private void releaseLocked(Reservation reservation) {
        PoolLedger home = ledger(reservation.pool());
        home.free(reservation.priority(), reservation.own());
        for (Loan loan : reservation.loans()) {
            PoolLedger lender = pools.get(loan.lenderPool());
            if (lender != null) {
                lender.repay(loan.lenderClass(), loan.amount());
            }
        }
        home.returnBorrowed(reservation.borrowed());
    }

    private List<PoolLedger> backendScope(PoolLedger home) {
        String backend = home.definition().backend();
        return pools.values().stream()
                .filter(ledger -> ledger.definition().backend().equals(backend))
                .sorted(Comparator.comparing(PoolLedger::name))
                .collect(Collectors.toList());
    }

    PoolLedger ledger(String poolName) {
        PoolLedger ledger = pools.get(poolName);
        if (ledger == null) {
            throw new IllegalArgumentException("Unknown pool: " + poolName);
        }
        return ledger;
    }

    private static void lockAll(List<PoolLedger> scope) {
        for (PoolLedger ledger : scope) {
            ledger.lock().lock();
        }
    }

    private static void unlockAll(List<PoolLedger> scope) {
        for (int i = scope.size() - 1; i >= 0; i--) {
            scope.get(i).lock().unlock();
        }
    }
}
