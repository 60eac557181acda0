package me.golemcore.careergraph.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data-quality signal for a skill claimed against a job or company. The skill is
 * considered connected when it is within the path budget and similar enough;
 * otherwise it is flagged as an anomaly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyReport {
    private String skill;
    private String target;
    private String targetNode;

    /**
     * Shortest path length, or {@code null} when the nodes are disconnected.
     */
    private Integer pathLength;

    private double similarity;
    private boolean connected;
    private boolean anomaly;
}
