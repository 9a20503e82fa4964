package org.neuralchilli.flotilla.quota;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.Priority;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable accounting of one pool. Usage counters are read and written holding {@link #lock()};
 * the definition is only replaced holding it and may be read without it.
 */
final class PoolLedger {

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Priority, Capacity> inUse = new EnumMap<>(Priority.class);
    private final Map<Priority, Capacity> lentOut = new EnumMap<>(Priority.class);
    private Capacity borrowedIn = Capacity.ZERO;
    private volatile Pool definition;

    PoolLedger(Pool definition) {
        this.name = definition.name();
        this.definition = definition;
        for (Priority priority : Priority.values()) {
            inUse.put(priority, Capacity.ZERO);
            lentOut.put(priority, Capacity.ZERO);
        }
    }

    String name() {
        return name;
    }

    ReentrantLock lock() {
        return lock;
    }

    Pool definition() {
        return definition;
    }

    void redefine(Pool pool) {
        this.definition = pool;
    }

    Capacity quota(Priority priority) {
        return definition.quotaFor(priority);
    }

    Capacity inUse(Priority priority) {
        return inUse.get(priority);
    }

    Capacity lentOut(Priority priority) {
        return lentOut.get(priority);
    }

    Capacity borrowedIn() {
        return borrowedIn;
    }

    /**
     * Quota of a class that is neither used by the pool itself nor lent out.
     */
    Capacity idle(Priority priority) {
        return quota(priority).minus(inUse(priority)).minus(lentOut(priority));
    }

    /**
     * Whether the class's quota ceiling admits {@code demand} more, ignoring loans.
     */
    boolean withinQuota(Priority priority, Capacity demand) {
        return inUse(priority).plus(demand).fitsWithin(quota(priority));
    }

    void use(Priority priority, Capacity amount) {
        inUse.put(priority, inUse(priority).plus(amount));
    }

    void free(Priority priority, Capacity amount) {
        inUse.put(priority, inUse(priority).minus(amount));
    }

    void lend(Priority priority, Capacity amount) {
        lentOut.put(priority, lentOut(priority).plus(amount));
    }

    void repay(Priority priority, Capacity amount) {
        lentOut.put(priority, lentOut(priority).minus(amount));
    }

    void borrow(Capacity amount) {
        borrowedIn = borrowedIn.plus(amount);
    }

    void returnBorrowed(Capacity amount) {
        borrowedIn = borrowedIn.minus(amount);
    }

    PoolUsage usage() {
        Map<Priority, PoolUsage.ClassUsage> classes = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            classes.put(priority, new PoolUsage.ClassUsage(
                    quota(priority), inUse(priority), lentOut(priority), idle(priority)));
        }
        return new PoolUsage(name, definition.backend(), definition.status(), classes, borrowedIn);
    }
}
