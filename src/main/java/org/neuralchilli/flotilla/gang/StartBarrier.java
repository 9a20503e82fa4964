package org.neuralchilli.flotilla.gang;

import org.neuralchilli.flotilla.domain.GroupKey;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Holds the user commands of a gang until every member reported READY.
 * Released at most once; a barrier that is not released by its deadline has expired.
 */
public final class StartBarrier {

    private final GroupKey group;
    private final Set<String> members;
    private final Set<String> arrived = new HashSet<>();
    private final Instant deadline;
    private boolean released;

    public StartBarrier(GroupKey group, Set<String> members, Instant deadline) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Barrier needs at least one member");
        }
        this.group = group;
        this.members = Set.copyOf(members);
        this.deadline = deadline;
    }

    /**
     * Record a member as ready.
     *
     * @return true exactly once, for the arrival that completes the barrier
     */
    public synchronized boolean arrive(String taskName) {
        if (released || !members.contains(taskName)) {
            return false;
        }
        arrived.add(taskName);
        if (arrived.size() == members.size()) {
            released = true;
            return true;
        }
        return false;
    }

    public boolean isMember(String taskName) {
        return members.contains(taskName);
    }

    public synchronized boolean isReleased() {
        return released;
    }

    public synchronized boolean isExpired(Instant now) {
        return !released && now.isAfter(deadline);
    }

    /**
     * Members that have not reported READY yet
     */
    public synchronized Set<String> pending() {
        Set<String> pending = new LinkedHashSet<>(members);
        pending.removeAll(arrived);
        return pending;
    }

    public GroupKey group() {
        return group;
    }

    public Set<String> members() {
        return members;
    }

    public Instant deadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return "StartBarrier{" + group + ", members=" + members.size() + ", deadline=" + deadline + "}";
    }
}
