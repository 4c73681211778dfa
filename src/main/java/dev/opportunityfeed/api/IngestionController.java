package dev.opportunityfeed.api;

import dev.opportunityfeed.IngestionRunner;
import dev.opportunityfeed.model.FetchRunStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Trigger surface: run ingestion now, inspect recent runs, abort the active run.
 */
@Slf4j
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    static final int MAX_LOG_LIMIT = 500;

    private final IngestionRunner ingestionRunner;

    @PostMapping("/run")
    public Mono<FetchRunStats> run() {
        log.info("Ingestion requested over HTTP");
        return Mono.fromCallable(ingestionRunner::runNow)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/logs")
    public List<FetchRunStats> logs(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ingestionRunner.recentRuns(Math.min(Math.max(limit, 0), MAX_LOG_LIMIT));
    }

    @PostMapping("/abort")
    public ResponseEntity<Map<String, Object>> abort() {
        boolean aborting = ingestionRunner.abort();
        return ResponseEntity.status(aborting ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
                .body(Map.of("aborting", aborting));
    }
}
