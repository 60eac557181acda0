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

import me.golemcore.careergraph.domain.exception.GraphException;

import java.util.Objects;

/**
 * Typed node identifier: the node type plus the full id string stored in the
 * graph. Built once at the ingestion boundary so the rest of the engine never
 * sniffs prefixes on its own.
 *
 * @param type
 *            node type
 * @param value
 *            full identifier as stored in the graph, e.g. {@code skill_Python}
 */
public record NodeId(NodeType type, String value) {

    public NodeId {
        Objects.requireNonNull(type, "type");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
    }

    /**
     * Canonical id for a domain key, e.g. {@code of(SKILL, "Python")} gives
     * {@code skill_Python}.
     */
    public static NodeId of(NodeType type, String key) {
        return new NodeId(type, type.prefix() + key);
    }

    /**
     * Id with a type inferred from its prefix. Unrecognized prefixes default to
     * {@link NodeType#SKILL} and the raw value is kept as-is.
     */
    public static NodeId parse(String raw) {
        return new NodeId(NodeType.fromPrefix(raw).orElse(NodeType.SKILL), raw);
    }

    /**
     * Id declared with an explicit type. A recognized prefix must agree with the
     * declared type.
     *
     * @throws GraphException
     *             with kind INVALID_TYPE on disagreement
     */
    public static NodeId declared(String raw, NodeType declaredType) {
        NodeType prefixType = NodeType.fromPrefix(raw).orElse(declaredType);
        if (prefixType != declaredType) {
            throw GraphException.invalidType("Node id '" + raw + "' has a " + prefixType.wireName()
                    + " prefix but was declared as " + declaredType.wireName());
        }
        return new NodeId(declaredType, raw);
    }

    /**
     * Domain key with the type prefix stripped.
     */
    public String key() {
        return value.startsWith(type.prefix()) ? value.substring(type.prefix().length()) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
