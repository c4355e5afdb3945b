package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;
import io.agentwarden.model.HealthStatus;
import io.agentwarden.model.HeartbeatRecord;
import io.agentwarden.storage.InMemoryHealthStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class HealthMonitorTest {
    private static final WorkerRole ROLE = new WorkerRole("architect", 1, List.of("true"), null, null,
            1_000L, 5_000L, 10_000L, 3, 60_000L, 90.0d, 1_000_000L);

    @Test
    void classifiesByHeartbeatAge() {
        InMemoryHealthStore store = new InMemoryHealthStore();
        HealthMonitor monitor = new HealthMonitor(store, pid -> true);
        WorkerProcess worker = started(new StubHandle(42L), 0L);

        store.heartbeat(new HeartbeatRecord("architect", 42L, 1_000L, 1.0d, 10L));
        Assertions.assertEquals(HealthStatus.HEALTHY, monitor.check(worker, 6_000L).status());
        Assertions.assertEquals(HealthStatus.STALE, monitor.check(worker, 6_001L).status());
        Assertions.assertEquals(HealthStatus.STALE, monitor.check(worker, 11_000L).status());
        HealthReport dead = monitor.check(worker, 11_001L);
        Assertions.assertEquals(HealthStatus.DEAD, dead.status());
        Assertions.assertEquals(10_001L, dead.heartbeatAgeMs());
    }

    @Test
    void startTimeIsTheReferenceUntilTheFirstHeartbeat() {
        HealthMonitor monitor = new HealthMonitor(new InMemoryHealthStore(), pid -> true);
        WorkerProcess worker = started(new StubHandle(42L), 1_000L);

        HealthReport fresh = monitor.check(worker, 2_000L);
        Assertions.assertEquals(HealthStatus.HEALTHY, fresh.status());
        Assertions.assertNull(fresh.heartbeat());
        Assertions.assertEquals(HealthStatus.STALE, monitor.check(worker, 7_000L).status());
    }

    @Test
    void heartbeatFromAnotherPidIsIgnored() {
        InMemoryHealthStore store = new InMemoryHealthStore();
        HealthMonitor monitor = new HealthMonitor(store, pid -> true);
        WorkerProcess worker = started(new StubHandle(42L), 0L);

        store.heartbeat(new HeartbeatRecord("architect", 41L, 20_000L, 1.0d, 10L));
        HealthReport report = monitor.check(worker, 20_000L);
        Assertions.assertEquals(HealthStatus.DEAD, report.status());
        Assertions.assertNull(report.heartbeat());
    }

    @Test
    void exitedProcessIsDeadRegardlessOfHeartbeat() {
        InMemoryHealthStore store = new InMemoryHealthStore();
        HealthMonitor monitor = new HealthMonitor(store, pid -> true);
        StubHandle handle = new StubHandle(42L);
        WorkerProcess worker = started(handle, 0L);
        store.heartbeat(new HeartbeatRecord("architect", 42L, 100L, 1.0d, 10L));

        handle.alive = false;
        HealthReport report = monitor.check(worker, 200L);
        Assertions.assertEquals(HealthStatus.DEAD, report.status());
        Assertions.assertTrue(report.reason().contains("not running"));

        Assertions.assertEquals(HealthStatus.DEAD,
                monitor.check(new WorkerProcess(ROLE), 200L).status());
    }

    @Test
    void resourceLimitsOnlyProduceWarnings() {
        InMemoryHealthStore store = new InMemoryHealthStore();
        HealthMonitor monitor = new HealthMonitor(store, pid -> true);
        WorkerProcess worker = started(new StubHandle(42L), 0L);
        store.heartbeat(new HeartbeatRecord("architect", 42L, 100L, 95.5d, 2_000_000L));

        HealthReport report = monitor.check(worker, 200L);
        Assertions.assertEquals(HealthStatus.HEALTHY, report.status());
        Assertions.assertEquals(2, report.warnings().size());
        Assertions.assertTrue(report.warnings().get(0).startsWith("cpu 95.5%"));
        Assertions.assertTrue(report.warnings().get(1).startsWith("memory 2000000 bytes"));
    }

    @Test
    void checkAllReportsEveryWorkerInOrder() {
        InMemoryHealthStore store = new InMemoryHealthStore();
        HealthMonitor monitor = new HealthMonitor(store, pid -> true);
        WorkerProcess healthy = started(new StubHandle(42L), 0L);
        WorkerProcess unstarted = new WorkerProcess(ROLE);

        List<HealthReport> reports = monitor.checkAll(List.of(healthy, unstarted), 1_000L);

        Assertions.assertEquals(2, reports.size());
        Assertions.assertEquals(HealthStatus.HEALTHY, reports.get(0).status());
        Assertions.assertEquals(HealthStatus.DEAD, reports.get(1).status());
        Assertions.assertEquals("no process", reports.get(1).reason());
    }

    private static WorkerProcess started(StubHandle handle, long atMs) {
        WorkerProcess worker = new WorkerProcess(ROLE);
        worker.started(handle, atMs);
        return worker;
    }

    private static final class StubHandle implements WorkerHandle {
        private final long pid;
        private boolean alive = true;

        private StubHandle(long pid) {
            this.pid = pid;
        }

        @Override
        public long pid() {
            return pid;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public void terminate() {
            alive = false;
        }

        @Override
        public void kill() {
            alive = false;
        }
    }
}
