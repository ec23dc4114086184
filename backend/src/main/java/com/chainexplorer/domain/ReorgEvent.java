package com.chainexplorer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Audit record of a resolved reorganization. Observability only.
 */
@Document(collection = "reorg_events")
@NoArgsConstructor
@Getter
@Setter
public class ReorgEvent {

    @Id
    private String id;
    private long divergenceHeight;
    private String oldHash;
    private String newHash;
    private long previousTip;
    private int blocksRolledBack;
    private ReorgTrigger trigger;
    @Indexed
    private Instant detectedAt;
}
