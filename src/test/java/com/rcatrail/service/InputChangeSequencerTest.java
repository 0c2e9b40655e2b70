package com.rcatrail.service;

import com.rcatrail.dto.InputChangeRow;
import com.rcatrail.model.HashTransition;
import com.rcatrail.model.InputChangeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InputChangeSequencerTest {

    private InputChangeSequencer sequencer;

    @BeforeEach
    void setUp() {
        sequencer = new InputChangeSequencer();
    }

    private static InputChangeRow row(String node, String at, String hash) {
        return InputChangeRow.builder()
                .scenarioId("s-1").nodeId(node).changedAt(at).inputHash(hash)
                .build();
    }

    @Test
    @DisplayName("previous hash and sequence are derived per node, in input order")
    void fillsMissingFields() {
        List<InputChangeRow> rows = List.of(
                row("X", "2026-02-11T10:40:00Z", "h3"),
                row("Y", "2026-02-11T10:00:00Z", "y1"),
                row("X", "2026-02-11T10:15:00Z", "h2"),
                row("X", "2026-02-11T09:00:00Z", "h1"));

        List<InputChangeRow> sequenced = sequencer.sequence(rows);

        assertEquals(4, sequenced.size());
        assertEquals("h3", sequenced.get(0).getInputHash());
        assertEquals("h2", sequenced.get(0).getPreviousHash());
        assertEquals(Long.valueOf(3), sequenced.get(0).getChangeSequence());

        assertNull(sequenced.get(1).getPreviousHash());
        assertEquals(Long.valueOf(1), sequenced.get(1).getChangeSequence());

        assertEquals("h1", sequenced.get(2).getPreviousHash());
        assertNull(sequenced.get(3).getPreviousHash());
    }

    @Test
    @DisplayName("values the source did send are kept")
    void keepsSourceValues() {
        InputChangeRow given = row("X", "2026-02-11T10:15:00Z", "h2").toBuilder()
                .previousHash("h0").changeSequence(7L)
                .build();

        List<InputChangeRow> sequenced = sequencer.sequence(List.of(row("X", "2026-02-11T09:00:00Z", "h1"), given));

        assertSame(given, sequenced.get(1));
    }

    @Test
    @DisplayName("rows with unreadable timestamps pass through untouched")
    void unparseable_passesThrough() {
        InputChangeRow broken = row("X", "not a time", "h1");

        assertSame(broken, sequencer.sequence(List.of(broken)).get(0));
    }

    // --- Incremental batches ---

    /** Stands in for the reporting store: normalizes loaded rows and answers latest-before lookups. */
    private static final class LoadedHistory implements InputChangeSequencer.StoredHistory {

        private final EventNormalizer normalizer = new EventNormalizer(new ErrorCategorizer());
        private final List<InputChangeRecord> stored = new ArrayList<>();

        void load(List<InputChangeRow> rows) {
            rows.forEach(r -> stored.add(InputChangeRecord.fromEvent(normalizer.normalize(r).get(0))));
        }

        @Override
        public Optional<InputChangeRecord> latestBefore(String scenarioId, String nodeId,
                                                                  Instant before) {
            return stored.stream()
                    .filter(r -> r.getNodeId().equals(nodeId) && r.getChangedAt().isBefore(before))
                    .max(Comparator.comparing(InputChangeRecord::getChangedAt));
        }
    }

    @Test
    @DisplayName("second batch continues the node history stored by the first")
    void secondBatch_continuesStoredHistory() {
        LoadedHistory history = new LoadedHistory();
        List<InputChangeRow> first = sequencer.sequence(List.of(
                row("X", "2026-02-11T09:00:00Z", "h1"),
                row("X", "2026-02-11T10:15:00Z", "h2")), history);
        history.load(first);

        List<InputChangeRow> second = sequencer.sequence(List.of(
                row("X", "2026-02-11T10:40:00Z", "h3"),
                row("Y", "2026-02-11T11:00:00Z", "y1")), history);

        assertEquals("h2", second.get(0).getPreviousHash());
        assertEquals(Long.valueOf(3), second.get(0).getChangeSequence());
        assertEquals(HashTransition.CHANGED, HashTransition.classify(second.get(0).getPreviousHash(), "h3"));
        assertNull(second.get(1).getPreviousHash());
        assertEquals(Long.valueOf(1), second.get(1).getChangeSequence());
    }

    @Test
    @DisplayName("re-loading a batch after later ones are stored sequences it as the first time")
    void reloadedBatch_isSequencedTheSame() {
        LoadedHistory history = new LoadedHistory();
        List<InputChangeRow> batch = List.of(
                row("X", "2026-02-11T09:00:00Z", "h1"),
                row("X", "2026-02-11T10:15:00Z", "h2"));
        List<InputChangeRow> first = sequencer.sequence(batch, history);
        history.load(first);
        history.load(sequencer.sequence(List.of(row("X", "2026-02-11T10:40:00Z", "h3")), history));

        List<InputChangeRow> again = sequencer.sequence(batch, history);

        for (int i = 0; i < batch.size(); i++) {
            assertEquals(first.get(i).getPreviousHash(), again.get(i).getPreviousHash());
            assertEquals(first.get(i).getChangeSequence(), again.get(i).getChangeSequence());
        }
    }
}
