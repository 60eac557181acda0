package me.golemcore.careergraph.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Job and candidate node ids to evaluate. Explanations are requested unless
 * {@code explain} is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequest {
    private String job;
    private String candidate;
    private Boolean explain;
}
