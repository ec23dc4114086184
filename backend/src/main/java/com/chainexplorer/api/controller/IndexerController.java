package com.chainexplorer.api.controller;

import com.chainexplorer.api.dto.CommandAcceptedResponse;
import com.chainexplorer.api.dto.ErrorBody;
import com.chainexplorer.api.dto.IndexerStatusResponse;
import com.chainexplorer.api.dto.ReorgEventResponse;
import com.chainexplorer.api.dto.ThroughputResponse;
import com.chainexplorer.api.dto.VerifyRangeRequest;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.ingestion.indexer.ChainIndexer;
import com.chainexplorer.ingestion.indexer.IndexerCommand;
import com.chainexplorer.ingestion.indexer.IndexerWorkQueue;
import com.chainexplorer.ingestion.query.IndexerStatus;
import com.chainexplorer.ingestion.query.IndexerStatusQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * Operator API: GET status, throughput and recent reorgs; POST verify and resume (queued, 202).
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final IndexerStatusQueryService statusQueryService;
    private final IndexerWorkQueue workQueue;
    private final ChainIndexer chainIndexer;

    @GetMapping("/status")
    public IndexerStatusResponse status() {
        IndexerStatus s = statusQueryService.currentStatus();
        return new IndexerStatusResponse(
                s.indexedHeight(),
                s.tipHash(),
                s.phase() != null ? s.phase().name() : null,
                s.halted(),
                s.haltReason(),
                s.haltedAt(),
                s.lastPollAt(),
                s.lastCommitAt(),
                s.backoffUntil(),
                amount(s.totalFees()),
                amount(s.totalLocked()));
    }

    @GetMapping("/throughput")
    public ThroughputResponse throughput() {
        ThroughputSnapshot t = statusQueryService.currentThroughput();
        return new ThroughputResponse(t.getCurrentTps(), t.getAvgTps1h(), t.getAvgBlockTime(),
                t.getBlocksInWindow(), t.getTxsInWindow(), t.getTipHeight(), t.getComputedAt());
    }

    @GetMapping("/reorgs")
    public List<ReorgEventResponse> reorgs(@RequestParam(defaultValue = "20") int limit) {
        return statusQueryService.recentReorgs(limit).stream()
                .map(e -> new ReorgEventResponse(e.getDivergenceHeight(), e.getOldHash(), e.getNewHash(),
                        e.getPreviousTip(), e.getBlocksRolledBack(),
                        e.getTrigger() != null ? e.getTrigger().name() : null, e.getDetectedAt()))
                .toList();
    }

    @PostMapping("/verify")
    public ResponseEntity<?> verify(@Valid @RequestBody VerifyRangeRequest request) {
        long from = request.fromHeight();
        long to = request.toHeight();
        chainIndexer.validateRange(from, to);
        boolean queued = workQueue.submit(IndexerCommand.VERIFY_RANGE, () -> chainIndexer.verifyRange(from, to));
        return accepted(queued, IndexerCommand.VERIFY_RANGE, "Verification of heights " + from + ".." + to + " queued");
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume() {
        boolean queued = workQueue.submit(IndexerCommand.RESUME, chainIndexer::resume);
        return accepted(queued, IndexerCommand.RESUME, "Resume queued");
    }

    private static ResponseEntity<?> accepted(boolean queued, IndexerCommand command, String message) {
        if (!queued) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorBody.of("INDEXER_UNAVAILABLE", "Indexer is shutting down"));
        }
        return ResponseEntity.accepted().body(new CommandAcceptedResponse(command.name(), message));
    }

    private static String amount(BigInteger value) {
        return value != null ? value.toString() : "0";
    }
}
