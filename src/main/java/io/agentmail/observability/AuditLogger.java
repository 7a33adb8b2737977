package io.agentmail.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentmail.security.SensitiveDataMasker;
import io.agentmail.util.Hashing;
import io.agentmail.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of coordination mutations. Each row carries the hash of the previous
 * row, so truncation or an edited line breaks the chain.
 */
public final class AuditLogger {
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
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

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now(clock).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new RuntimeException("Corrupt audit row in " + auditFile, e);
            }
        }
        return out;
    }

    /**
     * Recomputes every row hash and checks the prev_hash links.
     *
     * @return number of verified rows
     * @throws IllegalStateException at the first broken row
     */
    public int verifyChain() {
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : readLines()) {
            lineNo++;
            Map<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, ROW_TYPE);
            } catch (IOException e) {
                throw new IllegalStateException("Audit row " + lineNo + " is not valid JSON", e);
            }
            Object hash = row.remove("hash");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                throw new IllegalStateException("Audit row " + lineNo + " does not link to the previous row");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(hash)) {
                throw new IllegalStateException("Audit row " + lineNo + " hash mismatch");
            }
            expectedPrev = recomputed;
        }
        return lineNo;
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
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Corrupt last audit row in " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent ok(String action, String actor, String resource, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, "ok", details == null ? Map.of() : details);
        }

        public static AuditEvent denied(String action, String actor, String resource, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, "denied", details == null ? Map.of() : details);
        }
    }
}
