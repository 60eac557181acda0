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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.golemcore.careergraph.domain.exception.GraphException;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of node types held by the knowledge graph. Each type owns the id
 * prefix used to build canonical node identifiers ({@code job_<id>},
 * {@code skill_<name>}, ...).
 */
public enum NodeType {

    JOB("job_"),
    SKILL("skill_"),
    COMPANY("company_"),
    CANDIDATE("candidate_");

    private final String prefix;

    NodeType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a type from its lower-case wire name.
     *
     * @throws GraphException
     *             with kind INVALID_TYPE when the name is outside the fixed set
     */
    @JsonCreator
    public static NodeType fromWireName(String name) {
        if (name != null) {
            for (NodeType type : values()) {
                if (type.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return type;
                }
            }
        }
        throw GraphException.invalidType("Invalid node type: " + name);
    }

    /**
     * Type whose prefix the given id carries, if any.
     */
    public static Optional<NodeType> fromPrefix(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (NodeType type : values()) {
            if (id.startsWith(type.prefix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
