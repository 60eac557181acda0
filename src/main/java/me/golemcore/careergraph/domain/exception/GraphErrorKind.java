package me.golemcore.careergraph.domain.exception;

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

/**
 * Classification of failures surfaced by the graph engine.
 */
public enum GraphErrorKind {

    /**
     * Node type outside the fixed set, or an id prefix that disagrees with the
     * declared type.
     */
    INVALID_TYPE,

    /**
     * A referenced job, candidate, skill or target node is absent.
     */
    NOT_FOUND,

    /**
     * The canonical job source is missing or malformed; the rebuild is aborted.
     */
    SOURCE_INVALID,

    /**
     * The explanation generator failed or timed out. Recovered locally with a
     * fallback text.
     */
    GENERATOR_UNAVAILABLE,

    /**
     * The text encoder could not produce a vector.
     */
    ENCODER_UNAVAILABLE,

    /**
     * A durable snapshot write failed after all retries.
     */
    PERSISTENCE_FAILURE
}
