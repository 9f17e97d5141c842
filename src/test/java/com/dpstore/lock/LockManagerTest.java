package com.dpstore.lock;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class LockManagerTest {

    private InMemoryBackend backend;
    private MetricsCollector metrics;
    private LockManager manager;
    private LockManager other;

    @BeforeEach
    void setUp() {
        backend = new InMemoryBackend();
        metrics = new MetricsCollector();
        manager = new LockManager(backend, metrics);
        other = new LockManager(backend, new MetricsCollector());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void createOrGetLock_isIdempotent() throws Exception {
        long first = manager.createOrGetLock("batch-job");
        long second = other.createOrGetLock("batch-job");
        long unrelated = manager.createOrGetLock("nightly");

        assertThat(second).isEqualTo(first);
        assertThat(unrelated).isNotEqualTo(first);
        assertThat(manager.getLockInfo(first)).contains(LockInfo.free("batch-job"));
    }

    @Test
    void createOrGetLock_emptyName_throws() {
        assertThatThrownBy(() -> manager.createOrGetLock(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquireAndRelease_recordsOwner() throws Exception {
        long id = manager.createOrGetLock("batch-job");

        manager.acquireLock(id, 5, 3);
        LockInfo held = manager.getLockInfo(id).orElseThrow();
        assertThat(held.getUsageCount()).isEqualTo(1);
        assertThat(held.getOwnerPid()).isEqualTo(manager.getPid());
        assertThat(held.getExpirationEpochSeconds())
            .isGreaterThan(TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()));
        assertThat(manager.getPidForLock("batch-job")).isEqualTo(ProcessHandle.current().pid());

        manager.releaseLock(id);
        assertThat(manager.getLockInfo(id)).contains(LockInfo.free("batch-job"));
        assertThat(manager.getPidForLock("batch-job")).isZero();
        assertThat(backend.read(KeySchema.lockTokenKey(id))).isEmpty();
    }

    @Test
    void getPidForLock_unknownLock_isZero() throws Exception {
        assertThat(manager.getPidForLock("never-created")).isZero();
    }

    @Test
    void acquire_heldByOther_zeroWaitTimesOut() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 5, 3);

        assertThatThrownBy(() -> other.acquireLock(id, 5, 0))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR));
    }

    @Test
    void acquire_afterRelease_succeeds() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 5, 3);
        manager.releaseLock(id);

        other.acquireLock(id, 5, 0);

        assertThat(other.getLockInfo(id).orElseThrow().getUsageCount()).isEqualTo(1);
    }

    @Test
    void acquire_retryLimitReached_reportsLockError() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        MetricsCollector contenderMetrics = new MetricsCollector();
        LockManager contender = new LockManager(backend, contenderMetrics,
            new RetryPolicy(3, 1000, 5), sleeps::add);
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 5, 3);

        assertThatThrownBy(() -> contender.acquireLock(id, 5, 60))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_GET_LOCK_ERROR));
        assertThat(sleeps).hasSize(2);
        assertThat(contenderMetrics.getLockRetries()).isEqualTo(3);
    }

    @Test
    void acquire_interrupted_reportsTimeoutAndKeepsFlag() throws Exception {
        LockManager contender = new LockManager(backend, new MetricsCollector(), RetryPolicy.defaults(),
            nanos -> {
                throw new InterruptedException("test");
            });
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 5, 3);

        try {
            assertThatThrownBy(() -> contender.acquireLock(id, 5, 60))
                .isInstanceOfSatisfying(DpsException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void acquire_expiredLease_isReclaimed() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        long past = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()) - 10;
        // A holder that died without releasing: token without TTL, lease in the past
        backend.write(KeySchema.lockTokenKey(id), "4242@gone#1#1".getBytes(StandardCharsets.UTF_8), 0);
        backend.write(KeySchema.lockInfoKey(id),
            new LockInfo(1, past, 4242, "batch-job", "4242@gone#1#1").format().getBytes(StandardCharsets.UTF_8), 0);

        manager.acquireLock(id, 5, 1);

        assertThat(manager.getPidForLock("batch-job")).isEqualTo(manager.getPid());
        assertThat(metrics.getLockReclaimed()).isEqualTo(1);
    }

    @Test
    void acquire_expiredRecordOfPreviousHolder_keepsNewHoldersToken() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        long past = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()) - 10;
        // New holder inserted its token but has not written its info record yet
        backend.write(KeySchema.lockTokenKey(id), "777@fresh#2#2".getBytes(StandardCharsets.UTF_8), 0);
        backend.write(KeySchema.lockInfoKey(id),
            new LockInfo(1, past, 4242, "batch-job", "4242@gone#1#1").format().getBytes(StandardCharsets.UTF_8), 0);

        assertThatThrownBy(() -> manager.acquireLock(id, 5, 0))
            .isInstanceOf(DpsException.class);

        assertThat(backend.read(KeySchema.lockTokenKey(id)))
            .hasValueSatisfying(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("777@fresh#2#2"));
        assertThat(metrics.getLockReclaimed()).isZero();
    }

    @Test
    void acquire_expiredRecordWithoutSignature_isNotReclaimed() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        long past = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()) - 10;
        backend.write(KeySchema.lockTokenKey(id), "4242@gone#1#1".getBytes(StandardCharsets.UTF_8), 0);
        backend.write(KeySchema.lockInfoKey(id),
            new LockInfo(1, past, 4242, "batch-job").format().getBytes(StandardCharsets.UTF_8), 0);

        assertThatThrownBy(() -> manager.acquireLock(id, 5, 0))
            .isInstanceOf(DpsException.class);
        assertThat(metrics.getLockReclaimed()).isZero();
    }

    @Test
    void acquire_recordsOwnerSignatureMatchingToken() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 30, 1);

        byte[] token = backend.read(KeySchema.lockTokenKey(id)).orElseThrow();
        LockInfo info = LockInfo.parse(new String(backend.read(KeySchema.lockInfoKey(id)).orElseThrow(),
            StandardCharsets.UTF_8));

        assertThat(info.getOwnerSignature()).contains(new String(token, StandardCharsets.UTF_8));
        manager.releaseLock(id);
    }

    @Test
    void getPidForLock_corruptInfoRecord_isZero() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        backend.write(KeySchema.lockInfoKey(id), "garbage".getBytes(StandardCharsets.UTF_8), 0);

        assertThat(manager.getPidForLock("batch-job")).isZero();
    }

    @Test
    void acquire_liveLease_isNotReclaimed() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        long future = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()) + 60;
        backend.write(KeySchema.lockTokenKey(id), "4242@alive#1#1".getBytes(StandardCharsets.UTF_8), 0);
        backend.write(KeySchema.lockInfoKey(id),
            new LockInfo(1, future, 4242, "batch-job").format().getBytes(StandardCharsets.UTF_8), 0);

        assertThatThrownBy(() -> manager.acquireLock(id, 5, 0))
            .isInstanceOf(DpsException.class);
        assertThat(metrics.getLockReclaimed()).isZero();
        assertThat(manager.getPidForLock("batch-job")).isEqualTo(4242);
    }

    @Test
    void acquire_leaseEndsWithoutRelease_nextCallerGetsLock() throws Exception {
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 1, 3);

        long start = System.nanoTime();
        other.acquireLock(id, 5, 5);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5000);
        assertThat(other.getLockInfo(id).orElseThrow().getUsageCount()).isEqualTo(1);
    }

    @Test
    void acquire_unknownId_throws() {
        assertThatThrownBy(() -> manager.acquireLock(9999, 5, 1))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_INVALID_LOCK_ID_ERROR));
    }

    @Test
    void acquire_invalidArguments_throw() throws Exception {
        long id = manager.createOrGetLock("batch-job");

        assertThatThrownBy(() -> manager.acquireLock(id, 0, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.acquireLock(id, 5, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeLock_freeLock_deletesAllRecords() throws Exception {
        long id = manager.createOrGetLock("batch-job");

        manager.removeLock(id);

        assertThat(manager.findLockId("batch-job")).isEmpty();
        assertThat(manager.getLockInfo(id)).isEmpty();
        assertThat(backend.read(KeySchema.lockTokenKey(id))).isEmpty();
        assertThat(manager.createOrGetLock("batch-job")).isNotEqualTo(id);
    }

    @Test
    void removeLock_heldByOther_fails() throws Exception {
        LockManager remover = new LockManager(backend, new MetricsCollector(),
            new RetryPolicy(3, 0, 1), nanos -> { });
        long id = manager.createOrGetLock("batch-job");
        manager.acquireLock(id, 5, 3);

        assertThatThrownBy(() -> remover.removeLock(id))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_LOCK_REMOVAL_ERROR));
        assertThat(manager.findLockId("batch-job")).hasValue(id);
    }

    @Test
    void removeLock_unknownId_throws() {
        assertThatThrownBy(() -> manager.removeLock(9999))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_INVALID_LOCK_ID_ERROR));
    }

    @Test
    void generalPurposeLock_busyUntilReleased() throws Exception {
        LockManager impatient = new LockManager(backend, new MetricsCollector(),
            new RetryPolicy(2, 0, 1), nanos -> { });
        manager.acquireGeneralPurposeLock("orders");

        assertThatThrownBy(() -> impatient.acquireGeneralPurposeLock("orders"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_GET_GENERIC_LOCK_ERROR));

        manager.releaseGeneralPurposeLock("orders");
        impatient.acquireGeneralPurposeLock("orders");
        impatient.releaseGeneralPurposeLock("orders");
    }

    @Test
    void storeLock_busyUntilReleased() throws Exception {
        LockManager impatient = new LockManager(backend, new MetricsCollector(),
            new RetryPolicy(2, 0, 1), nanos -> { });
        manager.acquireStoreLock(7);

        assertThatThrownBy(() -> impatient.acquireStoreLock(7))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_GET_STORE_LOCK_ERROR));
        impatient.acquireStoreLock(8);

        manager.releaseStoreLock(7);
        impatient.acquireStoreLock(7);
    }

    @Test
    void concurrentAcquire_mutualExclusion() throws Exception {
        long id = manager.createOrGetLock("counter");
        int threads = 4;
        int iterations = 25;
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        int[] counter = {0};
        CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                LockManager contender = new LockManager(backend, new MetricsCollector());
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    for (int i = 0; i < iterations; i++) {
                        contender.acquireLock(id, 10, 20);
                        try {
                            maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                            counter[0]++;
                            holders.decrementAndGet();
                        } finally {
                            contender.releaseLock(id);
                        }
                    }
                    return null;
                }));
            }
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxHolders.get()).isEqualTo(1);
        assertThat(counter[0]).isEqualTo(threads * iterations);
    }
}
