package com.rcatrail.service;

import com.rcatrail.dto.InputChangeRow;
import com.rcatrail.model.InputChangeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills in previousHash and changeSequence on input-change rows the source sent
 * without them.
 *
 * Per (scenario, node), rows are ordered by changedAt (then any sequence the source
 * did give); each row's previous hash is the prior row's input hash and its sequence
 * is its 1-based position in the node's history.
 *
 * Batches are incremental, so the history does not start in this batch: the node's
 * latest version stored before its first row here seeds both the previous hash and
 * the sequence. Without a stored version the first row has no previous hash.
 *
 * Rows whose timestamp cannot be read are passed through untouched; the normalizer
 * rejects them later with a proper anomaly.
 */
@Component
@Slf4j
public class InputChangeSequencer {

    /** Latest stored version of a node before an instant. */
    @FunctionalInterface
    public interface StoredHistory {

        StoredHistory NONE = (scenarioId, nodeId, before) -> Optional.empty();

        Optional<InputChangeRecord> latestBefore(String scenarioId, String nodeId, Instant before);
    }

    public List<InputChangeRow> sequence(List<InputChangeRow> rows) {
        return sequence(rows, StoredHistory.NONE);
    }

    public List<InputChangeRow> sequence(List<InputChangeRow> rows, StoredHistory history) {
        Map<String, List<Keyed>> byNode = new LinkedHashMap<>();
        List<InputChangeRow> result = new ArrayList<>(rows.size());
        Map<InputChangeRow, InputChangeRow> replacements = new IdentityHashMap<>();

        for (InputChangeRow row : rows) {
            Instant changedAt = parseQuietly(row.getChangedAt());
            if (changedAt == null || row.getNodeId() == null) {
                continue;
            }
            String key = row.getScenarioId() + "/" + row.getNodeId();
            byNode.computeIfAbsent(key, k -> new ArrayList<>()).add(new Keyed(row, changedAt));
        }

        for (List<Keyed> versions : byNode.values()) {
            versions.sort(Comparator.comparing((Keyed k) -> k.changedAt)
                    .thenComparing(k -> k.row.getChangeSequence(), Comparator.nullsLast(Comparator.naturalOrder())));
            Keyed first = versions.get(0);
            Optional<InputChangeRecord> stored = first.row.getScenarioId() == null
                    ? Optional.empty()
                    : history.latestBefore(first.row.getScenarioId(), first.row.getNodeId(), first.changedAt);
            String previousHash = stored.map(InputChangeRecord::getNewHash).orElse(null);
            long position = stored.map(InputChangeRecord::getSequenceHint).orElse(0L);
            boolean seeded = stored.isPresent();
            for (Keyed version : versions) {
                position++;
                InputChangeRow row = version.row;
                boolean needsPrevious = row.getPreviousHash() == null && (seeded || position > 1);
                boolean needsSequence = row.getChangeSequence() == null;
                if (needsPrevious || needsSequence) {
                    replacements.put(row, row.toBuilder()
                            .previousHash(needsPrevious ? previousHash : row.getPreviousHash())
                            .changeSequence(needsSequence ? position : row.getChangeSequence())
                            .build());
                }
                previousHash = row.getInputHash();
            }
        }

        for (InputChangeRow row : rows) {
            result.add(replacements.getOrDefault(row, row));
        }
        if (!replacements.isEmpty()) {
            log.debug("Sequenced {} of {} input change rows", replacements.size(), rows.size());
        }
        return result;
    }

    private static Instant parseQuietly(String raw) {
        try {
            return TimestampParser.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("Leaving unparseable input change timestamp '{}' to the normalizer", raw);
            return null;
        }
    }

    private static final class Keyed {
        private final InputChangeRow row;
        private final Instant changedAt;

        Keyed(InputChangeRow row, Instant changedAt) {
            this.row = row;
            this.changedAt = changedAt;
        }
    }
}
