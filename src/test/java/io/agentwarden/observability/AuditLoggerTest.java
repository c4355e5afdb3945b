package io.agentwarden.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.observability.AuditLogger.AuditEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainVerifiesAcrossLoggerInstances() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditEvent.of("worker.started", "architect", 4242L, "ok",
                    Map.of("restartCount", 0, "priority", 1)));
            first.log(AuditEvent.of("worker.dead", "architect", 4242L, "error",
                    Map.of("reason", "process 4242 is not running", "failedInFlight", 2)));

            AuditLogger second = new AuditLogger(file);
            Assertions.assertEquals(first.currentHash(), second.currentHash());
            second.log(AuditEvent.byActor("message.sent", "cli", "architect", null, "ok",
                    Map.of("messageId", "msg_1", "ageMs", 9_000_000_000L, "roles", List.of("a", "b"))));

            Assertions.assertEquals(3, second.verify());
            List<JsonNode> tail = second.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals("message.sent", tail.get(1).path("action").asText());
            Assertions.assertEquals("cli", tail.get(1).path("actor").asText());
            Assertions.assertEquals("supervisor", tail.get(0).path("actor").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void interleavedWritersKeepOneChain() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-audit-interleave-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger supervisor = new AuditLogger(file);
            AuditLogger cli = new AuditLogger(file);

            supervisor.log(AuditEvent.of("supervisor.started", "supervisor", 10L, "ok", Map.of()));
            cli.log(AuditEvent.byActor("supervisor.stop.requested", "cli", "supervisor", 10L, "ok",
                    Map.of("immediate", false)));
            supervisor.log(AuditEvent.of("supervisor.shutdown.requested", "supervisor", 10L, "ok",
                    Map.of("mode", "GRACEFUL")));
            cli.log(AuditEvent.byActor("message.sent", "cli", "assistant", null, "ok", Map.of()));

            Assertions.assertEquals(4, cli.verify());
            Assertions.assertEquals(4, supervisor.verify());
            Assertions.assertEquals(cli.currentHash(), supervisor.tail(1).get(0).path("hash").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentWritersOnOneFileStayVerifiable() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-audit-concurrent-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger a = new AuditLogger(file);
            AuditLogger b = new AuditLogger(file);
            Thread ta = new Thread(() -> {
                for (int i = 0; i < 40; i++) {
                    a.log(AuditEvent.of("worker.checked", "architect", 1L, "ok", Map.of("i", i)));
                }
            });
            Thread tb = new Thread(() -> {
                for (int i = 0; i < 40; i++) {
                    b.log(AuditEvent.byActor("message.sent", "cli", "assistant", null, "ok", Map.of("i", i)));
                }
            });
            ta.start();
            tb.start();
            ta.join();
            tb.join();

            Assertions.assertEquals(80, new AuditLogger(file).verify());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditEvent.of("worker.started", "architect", 1L, "ok", Map.of()));
            audit.log(AuditEvent.of("worker.dead", "architect", 1L, "error", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"result\":\"error\"", "\"result\":\"ok\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, audit::verify);
            Assertions.assertTrue(e.getMessage().contains("row 2"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deletedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-audit-truncate-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditEvent.of("a", null, null, "ok", Map.of()));
            audit.log(AuditEvent.of("b", null, null, "ok", Map.of()));
            audit.log(AuditEvent.of("c", null, null, "ok", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);

            Assertions.assertThrows(IllegalStateException.class, audit::verify);
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
