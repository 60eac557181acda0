package me.golemcore.careergraph.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRequest {
    private String job;

    @Builder.Default
    private List<String> candidates = new ArrayList<>();

    private Integer topN;
    private Boolean explain;
}
