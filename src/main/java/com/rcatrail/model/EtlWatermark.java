package com.rcatrail.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Load progress of one source feed: the newest event timestamp loaded so far and
 * the outcome of the last batch that touched the feed.
 */
@Entity
@Table(name = "etl_watermarks")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EtlWatermark {

    public static final String STATUS_SUCCESS = "success";

    @Id
    @Column(name = "source_name", length = 64)
    private String sourceName;

    @Column(name = "last_loaded_at")
    private Instant lastLoadedAt;

    @Column(name = "last_run_completed")
    private Instant lastRunCompleted;

    @Column(name = "rows_loaded", nullable = false)
    private long rowsLoaded;

    @Column(nullable = false, length = 16)
    private String status;

    @Column(name = "last_batch_id")
    private String lastBatchId;
}
