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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an upsert: either the node was created (together with any missing
 * neighbors) or it already existed and nothing changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResult {

    private Status status;
    private String node;

    /**
     * Nodes created as a side effect (seeded skills/companies and auto-created
     * neighbors), in creation order.
     */
    @Builder.Default
    private List<String> createdNodes = new ArrayList<>();

    public enum Status {
        OK, EXISTS
    }

    public static UpsertResult exists(String node) {
        return UpsertResult.builder().status(Status.EXISTS).node(node).build();
    }

    public boolean isCreated() {
        return status == Status.OK;
    }
}
