package io.agentwarden.storage;

import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.model.RoleLockRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class SqliteRoleLockStoreTest {

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-lock-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SqliteRoleLockStore store = newStore(root);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                long pid = 1000L + i;
                Callable<Boolean> claim = () -> {
                    go.await();
                    return store.claim("architect", pid, 10L);
                };
                results.add(pool.submit(claim));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
            Assertions.assertEquals(1, store.list().size());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void releaseAndHandoverRequireTheCurrentHolder() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-lock-holder-");
        try {
            SqliteRoleLockStore store = newStore(root);
            Assertions.assertTrue(store.claim("architect", 100L, 1L));
            Assertions.assertFalse(store.claim("architect", 200L, 2L));

            Assertions.assertFalse(store.release("architect", 200L));
            Assertions.assertFalse(store.handover("architect", 200L, 300L));
            Assertions.assertTrue(store.handover("architect", 100L, 300L));

            RoleLockRecord lock = store.find("architect").orElseThrow();
            Assertions.assertEquals(300L, lock.holderPid());
            Assertions.assertEquals(1L, lock.acquiredAtMs());

            Assertions.assertFalse(store.release("architect", 100L));
            Assertions.assertTrue(store.release("architect", 300L));
            Assertions.assertTrue(store.find("architect").isEmpty());
            Assertions.assertTrue(store.claim("architect", 200L, 3L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reclaimStaleOnlyRemovesOldLocksOfDeadHolders() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-lock-reclaim-");
        try {
            SqliteRoleLockStore store = newStore(root);
            store.claim("dead_old", 11L, 1_000L);
            store.claim("alive_old", 12L, 1_000L);
            store.claim("dead_young", 13L, 9_500L);

            List<RoleLockRecord> reclaimed = store.reclaimStale(10_000L, 1_000L, pid -> pid == 12L);

            Assertions.assertEquals(1, reclaimed.size());
            Assertions.assertEquals("dead_old", reclaimed.get(0).role());
            Assertions.assertTrue(store.find("dead_old").isEmpty());
            Assertions.assertTrue(store.find("alive_old").isPresent());
            Assertions.assertTrue(store.find("dead_young").isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteRoleLockStore newStore(Path root) {
        Database db = new Database(AgentWardenConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteRoleLockStore(db);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
