package com.di.indexer.stats;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only REST surface over the indexed data.
 *
 * <pre>
 *   GET /api/indexer/stats
 *   GET /api/indexer/submissions?status=failed&amp;limit=50
 *   GET /api/indexer/submissions/{uid}
 *   GET /api/indexer/hosts/{ip}
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/indexer", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class StatsController {

    private final StatsService statsService;

    @GetMapping("/stats")
    public ResponseEntity<IndexerStats> stats() {
        return ResponseEntity.ok(statsService.stats());
    }

    @GetMapping("/submissions")
    public ResponseEntity<List<SubmissionSummary>> submissions(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(statsService.submissions(status, limit));
    }

    @GetMapping("/submissions/{uid}")
    public ResponseEntity<SubmissionSummary> submission(@PathVariable("uid") String uid) {
        return ResponseEntity.ok(statsService.submission(uid));
    }

    @GetMapping("/hosts/{ip:.+}")
    public ResponseEntity<HostReport> host(@PathVariable("ip") String ip) {
        return ResponseEntity.ok(statsService.host(ip));
    }
}
