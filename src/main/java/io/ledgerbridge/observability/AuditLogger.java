package io.ledgerbridge.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerbridge.util.Hashing;
import io.ledgerbridge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
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
 * Append-only JSON Lines audit trail. Each row carries the hash of the previous row, so a
 * removed or edited line breaks the chain at that point.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("item_kind", event.itemKind());
        row.put("item_id", event.itemId());
        row.put("details", event.details() == null ? Map.of() : event.details());
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

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash and checks the chain links.
     */
    public VerifyOutcome verify() {
        String prev = "";
        int rows = 0;
        for (String line : readLines()) {
            rows++;
            JsonNode node = parse(line);
            if (!(node instanceof ObjectNode obj)) {
                return new VerifyOutcome(false, rows, rows, "row is not an object");
            }
            String hash = obj.path("hash").asText("");
            if (!prev.equals(obj.path("prev_hash").asText(""))) {
                return new VerifyOutcome(false, rows, rows, "prev_hash mismatch");
            }
            ObjectNode unsigned = obj.deepCopy();
            unsigned.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unsigned)))) {
                return new VerifyOutcome(false, rows, rows, "hash mismatch");
            }
            prev = hash;
        }
        return new VerifyOutcome(true, rows, 0, "");
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            if (!Files.exists(auditFile)) {
                return out;
            }
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

    private static JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt audit row: " + line, e);
        }
    }

    public record VerifyOutcome(boolean valid, int rowsChecked, int firstBrokenRow, String reason) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String itemKind,
            String itemId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String resource,
                String result,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, "engine", resource, result, null, null, details == null ? Map.of() : details);
        }

        public static AuditEvent forItem(
                String action,
                String result,
                String itemKind,
                String itemId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    "engine",
                    itemKind + "/" + itemId,
                    result,
                    itemKind,
                    itemId,
                    details == null ? Map.of() : details
            );
        }
    }
}
