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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the natural-language explanation generator. Calls may be slow and may
 * fail; callers bound them with a timeout and substitute a fallback.
 */
public interface ExplanationPort {

    /**
     * Generate text for the given prompt.
     */
    CompletableFuture<String> generate(String prompt);

    /**
     * Whether a generator is configured and reachable in principle.
     */
    boolean isAvailable();

    String getProviderId();
}
