package me.golemcore.careergraph.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.careergraph.adapter.inbound.web.dto.AddNodeRequest;
import me.golemcore.careergraph.adapter.inbound.web.dto.ExtractSkillsRequest;
import me.golemcore.careergraph.adapter.inbound.web.dto.IngestCandidateRequest;
import me.golemcore.careergraph.adapter.inbound.web.dto.IngestJobRequest;
import me.golemcore.careergraph.auto.ReconciliationScheduler;
import me.golemcore.careergraph.domain.model.AnomalyReport;
import me.golemcore.careergraph.domain.model.GraphStatus;
import me.golemcore.careergraph.domain.model.SearchHit;
import me.golemcore.careergraph.domain.model.SimilarJobsResult;
import me.golemcore.careergraph.domain.model.SimilarSkillsResult;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;
import me.golemcore.careergraph.domain.model.UpsertResult;
import me.golemcore.careergraph.domain.service.AnomalyService;
import me.golemcore.careergraph.domain.service.GraphQueryService;
import me.golemcore.careergraph.domain.service.IngestionService;
import me.golemcore.careergraph.domain.service.MatchService;
import me.golemcore.careergraph.domain.service.NodeUpsertService;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Graph ingestion, search and inspection endpoints.
 */
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
public class GraphController {

    private static final int DEFAULT_SIMILAR_TOP_N = 5;

    private final NodeUpsertService nodeUpsertService;
    private final IngestionService ingestionService;
    private final MatchService matchService;
    private final GraphQueryService graphQueryService;
    private final AnomalyService anomalyService;
    private final ReconciliationScheduler reconciliationScheduler;
    private final CareerGraphProperties properties;

    @PostMapping("/nodes")
    public Mono<ResponseEntity<UpsertResult>> addNode(@RequestBody AddNodeRequest request) {
        return Mono.fromCallable(() -> nodeUpsertService.addNode(request.getId(), request.getType(),
                request.getNeighbors(), request.getMetadata()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/candidates")
    public Mono<ResponseEntity<UpsertResult>> ingestCandidate(@RequestBody IngestCandidateRequest request) {
        return Mono.fromCallable(() -> ingestionService.ingestCandidate(request.getApplicationId(),
                request.getName(), request.getEmail(), request.getUserId(), request.getCvText()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/jobs")
    public Mono<ResponseEntity<UpsertResult>> ingestJob(@RequestBody IngestJobRequest request) {
        return Mono.fromCallable(() -> ingestionService.ingestJob(request.getJobId(), request.getTitle(),
                request.getCompany(), request.getJobText()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<List<SearchHit>>> search(@RequestParam String query,
            @RequestParam(required = false) Integer k) {
        int limit = k != null ? k : properties.getSearch().getDefaultK();
        return Mono.fromCallable(() -> matchService.searchByText(query, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(hits -> {
                    hits.forEach(hit -> hit.setScore(Scores.round3(hit.getScore())));
                    return ResponseEntity.ok(hits);
                });
    }

    @GetMapping("/jobs/{jobKey}/similar")
    public Mono<ResponseEntity<SimilarJobsResult>> similarJobs(@PathVariable String jobKey,
            @RequestParam(required = false) Integer topN) {
        int limit = topN != null ? topN : DEFAULT_SIMILAR_TOP_N;
        return Mono.just(ResponseEntity.ok(graphQueryService.findSimilarJobs(jobKey, limit)));
    }

    @GetMapping("/skills/{skill}/similar")
    public Mono<ResponseEntity<SimilarSkillsResult>> similarSkills(@PathVariable String skill,
            @RequestParam(required = false) Integer topN) {
        int limit = topN != null ? topN : DEFAULT_SIMILAR_TOP_N;
        return Mono.just(ResponseEntity.ok(graphQueryService.findSimilarSkills(skill, limit)));
    }

    @PostMapping("/skills/extract")
    public Mono<ResponseEntity<Map<String, List<String>>>> extractSkills(
            @RequestBody ExtractSkillsRequest request) {
        List<String> skills = graphQueryService.extractKnownSkills(request.getText());
        return Mono.just(ResponseEntity.ok(Map.of("skills", skills)));
    }

    @GetMapping("/anomaly")
    public Mono<ResponseEntity<AnomalyReport>> checkAnomaly(@RequestParam String skill,
            @RequestParam String target,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(required = false) Double simThreshold) {
        AnomalyReport report = anomalyService.checkAnomaly(skill, target,
                maxDepth != null ? maxDepth : AnomalyService.DEFAULT_MAX_DEPTH,
                simThreshold != null ? simThreshold : AnomalyService.DEFAULT_SIM_THRESHOLD);
        report.setSimilarity(Scores.round3(report.getSimilarity()));
        return Mono.just(ResponseEntity.ok(report));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<GraphStatus>> status() {
        GraphStatus status = graphQueryService.status();
        status.setNextScheduledRebuild(reconciliationScheduler.getNextRunAt());
        return Mono.just(ResponseEntity.ok(status));
    }

    @GetMapping("/update-log")
    public Mono<ResponseEntity<List<UpdateLogEntry>>> updateLog() {
        return Mono.just(ResponseEntity.ok(graphQueryService.updateLog()));
    }
}
