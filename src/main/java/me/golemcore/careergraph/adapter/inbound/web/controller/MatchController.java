package me.golemcore.careergraph.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.careergraph.adapter.inbound.web.dto.EvaluateRequest;
import me.golemcore.careergraph.adapter.inbound.web.dto.RankRequest;
import me.golemcore.careergraph.domain.model.CandidateRanking;
import me.golemcore.careergraph.domain.model.MatchEvaluation;
import me.golemcore.careergraph.domain.model.RankedCandidate;
import me.golemcore.careergraph.domain.service.MatchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Job/candidate evaluation and ranking endpoints. Both may wait on the
 * explanation generator, so they run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/match")
@RequiredArgsConstructor
public class MatchController {

    private final MatchService matchService;

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<MatchEvaluation>> evaluate(@RequestBody EvaluateRequest request) {
        boolean explain = !Boolean.FALSE.equals(request.getExplain());
        return Mono.fromCallable(() -> matchService.evaluateMatch(request.getJob(), request.getCandidate(), explain))
                .subscribeOn(Schedulers.boundedElastic())
                .map(evaluation -> {
                    evaluation.setGraphScore(Scores.round3(evaluation.getGraphScore()));
                    evaluation.setEmbeddingSimilarity(Scores.round3(evaluation.getEmbeddingSimilarity()));
                    evaluation.setFinalScore(Scores.round3(evaluation.getFinalScore()));
                    return ResponseEntity.ok(evaluation);
                });
    }

    @PostMapping("/rank")
    public Mono<ResponseEntity<CandidateRanking>> rank(@RequestBody RankRequest request) {
        boolean explain = !Boolean.FALSE.equals(request.getExplain());
        return Mono.fromCallable(() -> matchService.rankCandidates(request.getJob(), request.getCandidates(),
                request.getTopN(), explain))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ranking -> {
                    for (RankedCandidate candidate : ranking.getRanked()) {
                        candidate.setFinalScore(Scores.round3(candidate.getFinalScore()));
                        candidate.setGraphScore(Scores.round3(candidate.getGraphScore()));
                        candidate.setSimilarity(Scores.round3(candidate.getSimilarity()));
                    }
                    return ResponseEntity.ok(ranking);
                });
    }
}
