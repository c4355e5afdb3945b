package io.agentwarden.supervisor;

import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.config.WorkerRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class OsProcessLauncherTest {

    @Test
    void childOutputIsAppendedToTheRoleLog() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-launcher-");
        try {
            AgentWardenConfig config = AgentWardenConfig.fromRoot(root.toString());
            OsProcessLauncher launcher = new OsProcessLauncher(config);
            String java = ProcessHandle.current().info().command().orElse("java");
            WorkerRole role = WorkerRole.withDefaults("assistant", 1, List.of(java, "-version"));

            WorkerHandle handle = launcher.launch(role);
            Assertions.assertTrue(handle.pid() > 0L);
            long deadline = System.currentTimeMillis() + 30_000L;
            while (handle.isAlive() && System.currentTimeMillis() < deadline) {
                Thread.sleep(50L);
            }

            Assertions.assertFalse(handle.isAlive());
            String log = Files.readString(config.workerLogFile("assistant"), StandardCharsets.UTF_8);
            Assertions.assertTrue(log.contains("version"), log);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingExecutableIsASpawnFailure() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-launcher-missing-");
        try {
            OsProcessLauncher launcher = new OsProcessLauncher(AgentWardenConfig.fromRoot(root.toString()));
            WorkerRole role = WorkerRole.withDefaults("architect", 1,
                    List.of(root.resolve("no-such-binary").toString()));

            ProcessSpawnException e = Assertions.assertThrows(ProcessSpawnException.class, () -> launcher.launch(role));
            Assertions.assertEquals("architect", e.role());
        } finally {
            deleteRecursively(root);
        }
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
