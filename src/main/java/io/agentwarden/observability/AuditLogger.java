package io.agentwarden.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.util.Hashing;
import io.agentwarden.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSON-lines event log. Every row carries the hash of the previous
 * row so that truncation or edits are detectable by {@link #verify()}.
 */
public final class AuditLogger {
    private static final int TAIL_CHUNK_BYTES = 8_192;
    // FileChannel locks are per JVM, so loggers of one JVM also serialize on the path.
    private static final ConcurrentMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    /**
     * Appends one row. Several processes share the file, so the previous hash
     * is re-read from the file's last row while holding an exclusive lock.
     */
    public void log(AuditEvent event) {
        synchronized (monitorFor(auditFile)) {
            try (FileChannel channel = FileChannel.open(auditFile, StandardOpenOption.CREATE,
                    StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                String prevHash = lastHash(channel);
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("timestamp", Instant.now().toString());
                row.put("action", event.action());
                row.put("actor", event.actor());
                row.put("role", event.role());
                row.put("pid", event.pid());
                row.put("result", event.result());
                row.put("details", event.details());
                row.put("prev_hash", prevHash);
                String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
                row.put("hash", rowHash);
                ByteBuffer line = ByteBuffer.wrap((Jsons.toCompactJson(row) + System.lineSeparator())
                        .getBytes(StandardCharsets.UTF_8));
                long position = channel.size();
                while (line.hasRemaining()) {
                    position += channel.write(line, position);
                }
                synchronized (this) {
                    previousHash = rowHash;
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(Jsons.readTree(line));
        }
        return out;
    }

    /**
     * Re-computes the hash chain. Returns the number of verified rows, or throws
     * {@link IllegalStateException} at the first broken link.
     */
    public synchronized int verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            JsonNode node = Jsons.readTree(line);
            String prev = node.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                throw new IllegalStateException("Audit chain broken at row " + (checked + 1));
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", node.path("timestamp").asText());
            row.put("action", textOrNull(node, "action"));
            row.put("actor", textOrNull(node, "actor"));
            row.put("role", textOrNull(node, "role"));
            row.put("pid", node.path("pid").isNull() || node.path("pid").isMissingNode() ? null : node.path("pid").asLong());
            row.put("result", textOrNull(node, "result"));
            row.put("details", Jsons.mapper().convertValue(node.path("details"), Map.class));
            row.put("prev_hash", prev);
            String hash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!hash.equals(node.path("hash").asText(""))) {
                throw new IllegalStateException("Audit hash mismatch at row " + (checked + 1));
            }
            expectedPrev = hash;
            checked++;
        }
        return checked;
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return hashOf(lines.get(lines.size() - 1));
    }

    private static String hashOf(String line) {
        try {
            return Jsons.readTree(line).path("hash").asText("");
        } catch (IllegalArgumentException e) {
            System.err.println("WARN audit log tail is not valid JSON, starting a new chain: " + e.getMessage());
            return "";
        }
    }

    /**
     * Hash of the last non-blank line, read backwards from the end of the file.
     */
    static String lastHash(FileChannel channel) throws IOException {
        long position = channel.size();
        byte[] tail = new byte[0];
        while (position > 0L) {
            int n = (int) Math.min(TAIL_CHUNK_BYTES, position);
            position -= n;
            ByteBuffer chunk = ByteBuffer.allocate(n);
            while (chunk.hasRemaining()) {
                if (channel.read(chunk, position + chunk.position()) < 0) {
                    break;
                }
            }
            byte[] merged = new byte[n + tail.length];
            System.arraycopy(chunk.array(), 0, merged, 0, n);
            System.arraycopy(tail, 0, merged, n, tail.length);
            tail = merged;
            String text = new String(tail, StandardCharsets.UTF_8).stripTrailing();
            int newline = text.lastIndexOf('\n');
            if (newline >= 0) {
                return hashOf(text.substring(newline + 1).strip());
            }
            if (position == 0L && !text.isEmpty()) {
                return hashOf(text.strip());
            }
        }
        return "";
    }

    private static Object monitorFor(Path file) {
        return MONITORS.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new Object());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNull() || value.isMissingNode() ? null : value.asText();
    }

    public record AuditEvent(
            String action,
            String actor,
            String role,
            Long pid,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String role, Long pid, String result, Map<String, Object> details) {
            return new AuditEvent(action, "supervisor", role, pid, result, details == null ? Map.of() : details);
        }

        public static AuditEvent byActor(String action, String actor, String role, Long pid, String result,
                                         Map<String, Object> details) {
            return new AuditEvent(action, actor, role, pid, result, details == null ? Map.of() : details);
        }
    }
}
