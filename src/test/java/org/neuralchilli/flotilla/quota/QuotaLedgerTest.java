package org.neuralchilli.flotilla.quota;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.flotilla.TestWorkflows;
import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.domain.PoolStatus;
import org.neuralchilli.flotilla.domain.Priority;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.neuralchilli.flotilla.TestWorkflows.POOL;
import static org.neuralchilli.flotilla.TestWorkflows.SIBLING;

class QuotaLedgerTest {

    private QuotaLedger ledger;
    private long sequence;

    @BeforeEach
    void setUp() {
        ledger = new QuotaLedger();
        ledger.configure(TestWorkflows.pools());
        sequence = 0;
    }

    @Test
    void shouldAdmitWithinClassQuota() {
        // When
        AdmissionDecision decision = reserve(POOL, Priority.HIGH, Capacity.of(2, 4));

        // Then
        assertThat(decision.isAdmitted()).isTrue();
        Reservation reservation = ((AdmissionDecision.Admitted) decision).reservation();
        assertThat(reservation.own()).isEqualTo(Capacity.of(2, 4));
        assertThat(reservation.isBorrowing()).isFalse();
        assertThat(ledger.usage(POOL).of(Priority.HIGH).used()).isEqualTo(Capacity.of(2, 4));
        assertThat(ledger.usage(POOL).of(Priority.HIGH).free()).isEqualTo(Capacity.of(0, 12));
    }

    @Test
    void shouldBlockWhenClassQuotaExhausted() {
        reserve(POOL, Priority.NORMAL, Capacity.of(2, 1));

        AdmissionDecision decision = reserve(POOL, Priority.NORMAL, Capacity.of(1, 1));

        assertThat(decision.isAdmitted()).isFalse();
        assertThat(((AdmissionDecision.Blocked) decision).reason())
                .isEqualTo("NORMAL quota of pool gpu-pool exhausted");
    }

    @Test
    void shouldNotLetHighUseNormalQuota() {
        reserve(POOL, Priority.HIGH, Capacity.of(2, 1));

        assertThat(ledger.canAdmit(POOL, Priority.HIGH, Capacity.of(1, 1))).isFalse();
        assertThat(ledger.canAdmit(POOL, Priority.NORMAL, Capacity.of(2, 1))).isTrue();
    }

    @Test
    void shouldLetLowBorrowIdleSiblingQuota() {
        // Given: gpu-pool has no LOW quota, sibling-pool has 2 idle NORMAL GPUs

        // When
        AdmissionDecision decision = reserve(POOL, Priority.LOW, Capacity.of(2, 2));

        // Then
        assertThat(decision.isAdmitted()).isTrue();
        Reservation reservation = ((AdmissionDecision.Admitted) decision).reservation();
        assertThat(reservation.own()).isEqualTo(Capacity.ZERO);
        assertThat(reservation.loans()).containsExactly(new Loan(SIBLING, Priority.NORMAL, Capacity.of(2, 2)));
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).lentOut()).isEqualTo(Capacity.of(2, 2));
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).free()).isEqualTo(Capacity.of(0, 14));
        assertThat(ledger.usage(POOL).borrowedIn()).isEqualTo(Capacity.of(2, 2));
    }

    @Test
    void shouldNeverLetLowBorrowFromItsOwnPool() {
        // Given: gpu-pool has 4 idle GPUs of HIGH and NORMAL quota, the sibling only 2

        // When
        AdmissionDecision decision = reserve(POOL, Priority.LOW, Capacity.of(3, 1));

        // Then
        assertThat(decision.isAdmitted()).isFalse();
        assertThat(ledger.usage(POOL).of(Priority.NORMAL).lentOut()).isEqualTo(Capacity.ZERO);
        assertThat(ledger.reservations()).isEmpty();
    }

    @Test
    void shouldNotBorrowFromOfflineSibling() {
        ledger.configure(List.of(
                TestWorkflows.pools().get(0),
                TestWorkflows.pools().get(1).withStatus(PoolStatus.MAINTENANCE)));

        assertThat(reserve(POOL, Priority.LOW, Capacity.of(1, 1)).isAdmitted()).isFalse();
    }

    @Test
    void shouldPreemptBorrowerWhenLenderNeedsItsQuota() {
        // Given: a LOW group of gpu-pool holds sibling-pool's NORMAL quota
        GroupKey borrower = key("low-train");
        ledger.reserve(POOL, borrower, Priority.LOW, Capacity.of(2, 2), ++sequence);

        // When: sibling-pool admits NORMAL work within its quota
        assertThat(ledger.reclaimPlan(SIBLING, Priority.NORMAL, Capacity.of(2, 2)))
                .extracting(Reservation::group)
                .containsExactly(borrower);
        AdmissionDecision decision = reserve(SIBLING, Priority.NORMAL, Capacity.of(2, 2));

        // Then: the borrower is revoked in the same step
        assertThat(decision.isAdmitted()).isTrue();
        assertThat(((AdmissionDecision.Admitted) decision).preempted())
                .extracting(Reservation::group)
                .containsExactly(borrower);
        assertThat(ledger.reservation(borrower)).isEmpty();
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).lentOut()).isEqualTo(Capacity.ZERO);
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).used()).isEqualTo(Capacity.of(2, 2));
        assertThat(ledger.usage(POOL).borrowedIn()).isEqualTo(Capacity.ZERO);
    }

    @Test
    void shouldNotPreemptWhenLenderExceedsItsQuota() {
        GroupKey borrower = key("low-train");
        ledger.reserve(POOL, borrower, Priority.LOW, Capacity.of(2, 2), ++sequence);

        AdmissionDecision decision = reserve(SIBLING, Priority.NORMAL, Capacity.of(3, 1));

        assertThat(decision.isAdmitted()).isFalse();
        assertThat(ledger.reservation(borrower)).isPresent();
        assertThat(ledger.reclaimPlan(SIBLING, Priority.NORMAL, Capacity.of(3, 1))).isEmpty();
    }

    @Test
    void shouldPreemptPoolFurthestOverItsQuotaFirst() {
        // Given: pool b borrows 2 GPUs in two groups, pool a borrows 1 GPU last
        ledger.reset();
        ledger.configure(List.of(
                TestWorkflows.pool("a", Capacity.ZERO, Capacity.ZERO, Capacity.ZERO),
                TestWorkflows.pool("b", Capacity.ZERO, Capacity.ZERO, Capacity.ZERO),
                TestWorkflows.pool("lender", Capacity.ZERO, Capacity.of(4, 32), Capacity.ZERO)));
        GroupKey b1 = key("b1");
        GroupKey b2 = key("b2");
        GroupKey a1 = key("a1");
        ledger.reserve("b", b1, Priority.LOW, Capacity.of(1, 1), ++sequence);
        ledger.reserve("b", b2, Priority.LOW, Capacity.of(1, 1), ++sequence);
        ledger.reserve("a", a1, Priority.LOW, Capacity.of(1, 1), ++sequence);

        // When: the lender needs 2 GPUs and has 1 idle
        AdmissionDecision decision = reserve("lender", Priority.NORMAL, Capacity.of(2, 2));

        // Then: the latest admission of pool b goes, pool a keeps its loan
        assertThat(((AdmissionDecision.Admitted) decision).preempted())
                .extracting(Reservation::group)
                .containsExactly(b2);
        assertThat(ledger.reservation(a1)).isPresent();
        assertThat(ledger.reservation(b1)).isPresent();
    }

    @Test
    void shouldPreemptMostRecentAdmissionAmongEquals() {
        GroupKey first = key("first");
        GroupKey second = key("second");
        ledger.reserve(POOL, first, Priority.LOW, Capacity.of(1, 1), ++sequence);
        ledger.reserve(POOL, second, Priority.LOW, Capacity.of(1, 1), ++sequence);

        AdmissionDecision decision = reserve(SIBLING, Priority.NORMAL, Capacity.of(1, 1));

        assertThat(((AdmissionDecision.Admitted) decision).preempted())
                .extracting(Reservation::group)
                .containsExactly(second);
    }

    @Test
    void shouldRepayLoansOnRelease() {
        GroupKey borrower = key("low");
        ledger.reserve(POOL, borrower, Priority.LOW, Capacity.of(2, 2), ++sequence);

        assertThat(ledger.release(borrower)).isPresent();

        assertThat(ledger.release(borrower)).isEmpty();
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).lentOut()).isEqualTo(Capacity.ZERO);
        assertThat(ledger.usage(POOL).borrowedIn()).isEqualTo(Capacity.ZERO);
        assertThat(ledger.canAdmit(POOL, Priority.LOW, Capacity.of(2, 2))).isTrue();
    }

    @Test
    void shouldRejectSecondReservationOfSameGroup() {
        GroupKey group = key("twice");
        ledger.reserve(POOL, group, Priority.HIGH, Capacity.of(1, 1), ++sequence);

        assertThatThrownBy(() -> ledger.reserve(POOL, group, Priority.HIGH, Capacity.of(1, 1), ++sequence))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already holds a reservation");
    }

    @Test
    void shouldJudgeStaticFeasibilityFromConfigurationAlone() {
        assertThat(ledger.isStaticallyFeasible(POOL, Priority.HIGH, Capacity.of(2, 16))).isTrue();
        assertThat(ledger.isStaticallyFeasible(POOL, Priority.HIGH, Capacity.of(3, 1))).isFalse();
        assertThat(ledger.isStaticallyFeasible(POOL, Priority.LOW, Capacity.of(2, 1))).isTrue();
        assertThat(ledger.isStaticallyFeasible(POOL, Priority.LOW, Capacity.of(3, 1))).isFalse();
        assertThat(ledger.isStaticallyFeasible(SIBLING, Priority.HIGH, Capacity.of(1, 1))).isFalse();
    }

    @Test
    void shouldFailForUnknownPool() {
        assertThatThrownBy(() -> ledger.usage("nowhere"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown pool: nowhere");
        assertThat(ledger.pool("nowhere")).isEmpty();
    }

    @Test
    void shouldTakeUnconfiguredPoolsOfflineAndKeepUsage() {
        // Given
        ledger.reserve(SIBLING, key("running"), Priority.NORMAL, Capacity.of(1, 1), ++sequence);

        // When: the new configuration drops sibling-pool
        ledger.configure(List.of(TestWorkflows.pools().get(0)));

        // Then
        assertThat(ledger.pool(SIBLING)).map(Pool::status).contains(PoolStatus.OFFLINE);
        assertThat(ledger.usage(SIBLING).of(Priority.NORMAL).used()).isEqualTo(Capacity.of(1, 1));
        assertThat(ledger.siblings(POOL)).extracting(Pool::name).containsExactly(SIBLING);
    }

    @Test
    void shouldWaitForPoolLockBeforeTakingPoolOffline() throws Exception {
        // Given: an admission step holds the sibling's lock
        PoolLedger sibling = ledger.ledger(SIBLING);
        sibling.lock().lock();

        // When
        CompletableFuture<Void> reconfigure =
                CompletableFuture.runAsync(() -> ledger.configure(List.of(TestWorkflows.pools().get(0))));
        try {
            // Then: the definition is left alone until the lock is released
            await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                    .until(() -> !reconfigure.isDone());
            assertThat(ledger.pool(SIBLING)).map(Pool::status).contains(PoolStatus.ONLINE);
        } finally {
            sibling.lock().unlock();
        }

        reconfigure.get(5, TimeUnit.SECONDS);
        assertThat(ledger.pool(SIBLING)).map(Pool::status).contains(PoolStatus.OFFLINE);
    }

    private AdmissionDecision reserve(String pool, Priority priority, Capacity demand) {
        return ledger.reserve(pool, key(priority + "-" + (sequence + 1)), priority, demand, ++sequence);
    }

    private static GroupKey key(String group) {
        return GroupKey.of(UUID.randomUUID(), group);
    }
}
