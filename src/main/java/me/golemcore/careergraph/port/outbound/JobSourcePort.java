package me.golemcore.careergraph.port.outbound;

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

import me.golemcore.careergraph.domain.model.CanonicalJobRow;

import java.util.List;

/**
 * Port for the canonical job dataset consumed by the full rebuild.
 */
public interface JobSourcePort {

    /**
     * Load every job row.
     *
     * @throws me.golemcore.careergraph.domain.exception.GraphException
     *             with kind SOURCE_INVALID when the source is missing, empty or
     *             lacks a required field
     */
    List<CanonicalJobRow> loadJobs();
}
