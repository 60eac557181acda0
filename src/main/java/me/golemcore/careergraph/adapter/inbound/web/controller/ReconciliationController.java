package me.golemcore.careergraph.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.careergraph.domain.model.RebuildResult;
import me.golemcore.careergraph.domain.service.ReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * On-demand full rebuild. Responds 409 while another rebuild is running.
 */
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @PostMapping("/run")
    public Mono<ResponseEntity<RebuildResult>> run() {
        return Mono.fromCallable(reconciliationService::rebuild)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
