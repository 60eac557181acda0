package me.golemcore.careergraph.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestCandidateRequest {
    private String applicationId;
    private String name;
    private String email;
    private String userId;
    private String cvText;
}
