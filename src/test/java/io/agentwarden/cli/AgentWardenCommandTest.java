package io.agentwarden.cli;

import io.agentwarden.config.AgentWardenConfig;
import io.agentwarden.config.SupervisorSettings;
import io.agentwarden.model.WorkerState;
import io.agentwarden.model.WorkerStatusSnapshot;
import io.agentwarden.runtime.AgentWardenRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class AgentWardenCommandTest {

    @Test
    void initWritesSettingsThatRelaunchThisCli() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-init-");
        try {
            Assertions.assertEquals(0, execute(root, "init"));

            SupervisorSettings settings = SupervisorSettings.load(AgentWardenConfig.fromRoot(root.toString()).settingsFile());
            List<String> command = settings.role("architect").command();
            Assertions.assertTrue(command.contains("io.agentwarden.Main"));
            Assertions.assertEquals(List.of("run-worker", "--role", "architect"),
                    command.subList(command.size() - 3, command.size()));
            Assertions.assertTrue(command.contains("--root"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queueCommandsRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-queue-");
        try {
            Assertions.assertEquals(0, execute(root, "send", "--to", "assistant", "--type", "ping",
                    "--payload", "{\"n\":1}", "--priority", "urgent"));
            Assertions.assertNotEquals(0, execute(root, "send", "--to", "assistant", "--type", "ping",
                    "--payload", "{broken"));
            Assertions.assertEquals(0, execute(root, "run-worker", "--role", "assistant", "--once"));
            Assertions.assertEquals(0, execute(root, "messages", "--recipient", "cli", "--status", "pending"));
            Assertions.assertEquals(0, execute(root, "messages-stats"));
            Assertions.assertEquals(0, execute(root, "metrics", "--prometheus"));
            Assertions.assertEquals(0, execute(root, "metrics", "--role", "assistant"));
            Assertions.assertEquals(0, execute(root, "purge", "--older-than-ms", "0"));
            Assertions.assertEquals(0, execute(root, "audit-verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusExitCodeReflectsTerminalWorkers() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-status-");
        try {
            Assertions.assertEquals(0, execute(root, "status"));
            Assertions.assertEquals(0, execute(root, "stop", "--wait-ms", "0"));

            AgentWardenRuntime runtime = new AgentWardenRuntime(AgentWardenConfig.fromRoot(root.toString()));
            runtime.healthStore().publishStatus(List.of(new WorkerStatusSnapshot("architect", WorkerState.TERMINAL,
                    "terminal", null, null, 0L, 3, 3, null, null, null, null, List.of(), 0L)));

            Assertions.assertEquals(1, execute(root, "status"));
            Assertions.assertEquals(1, execute(root, "status", "--json"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runWorkerWithoutRoleIsAUsageError() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-cli-worker-");
        try {
            Assertions.assertEquals(2, execute(root, "run-worker", "--role", " ", "--once"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusTableFormatsDurationsAndMissingValues() {
        Assertions.assertEquals("45s", AgentWardenCommand.StatusTable.duration(45_999L));
        Assertions.assertEquals("2m5s", AgentWardenCommand.StatusTable.duration(125_000L));
        Assertions.assertEquals("3h7m", AgentWardenCommand.StatusTable.duration(11_220_000L));
        Assertions.assertEquals("1.5MB", AgentWardenCommand.StatusTable.megabytes(1_572_864L));

        String table = AgentWardenCommand.StatusTable.render(List.of(new WorkerStatusSnapshot("architect",
                WorkerState.CRASHED, "crashed-retrying(2/3)", null, null, 0L, 1, 3, null, null, null, null,
                List.of("cpu 95.0% above limit 90.0%"), 0L)));
        Assertions.assertTrue(table.contains("crashed-retrying(2/3)"));
        Assertions.assertTrue(table.contains("1/3"));
        Assertions.assertTrue(table.contains("  ! cpu 95.0% above limit 90.0%"));
    }

    @Test
    void helpListsSupervisorExitCodes() {
        CommandLine cli = new CommandLine(new AgentWardenCommand());
        String start = cli.getSubcommands().get("start").getUsageMessage();
        String status = cli.getSubcommands().get("status").getUsageMessage();

        Assertions.assertTrue(start.contains("Exit codes:"));
        Assertions.assertTrue(start.contains("force-killed"));
        Assertions.assertTrue(start.contains("lock"));
        Assertions.assertTrue(status.contains("terminal"));
        Assertions.assertTrue(status.contains("forced"));
    }

    private static int execute(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new AgentWardenCommand()).execute(full);
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
