package me.golemcore.careergraph.domain.graph;

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

import me.golemcore.careergraph.domain.model.GraphNode;
import me.golemcore.careergraph.domain.model.GraphSnapshot;
import me.golemcore.careergraph.domain.model.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Typed nodes with undirected, unweighted adjacency. Additive only: there is no
 * node or edge removal. Iteration order of nodes, neighbors and edges is
 * insertion order.
 *
 * <p>
 * Not thread-safe; callers go through {@link GraphStateHolder}.
 */
public class KnowledgeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> adjacency = new HashMap<>();
    private final Map<EdgeKey, GraphSnapshot.Edge> edges = new LinkedHashMap<>();

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Adds a node unless one with the same id exists.
     *
     * @return {@code false} when the id was already present, in which case
     *         neither metadata nor edges are touched
     */
    public boolean addNode(String id, NodeType type, Map<String, Object> metadata) {
        if (nodes.containsKey(id)) {
            return false;
        }
        GraphNode node = GraphNode.builder()
                .id(id)
                .type(type)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
        nodes.put(id, node);
        adjacency.put(id, new LinkedHashSet<>());
        return true;
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public void addEdge(String a, String b) {
        addEdge(a, b, null);
    }

    /**
     * Links two existing nodes. No-op for an existing pair (in either direction)
     * and for self-loops.
     *
     * @throws IllegalArgumentException
     *             if either endpoint is absent
     */
    public void addEdge(String a, String b, String relation) {
        if (!nodes.containsKey(a) || !nodes.containsKey(b)) {
            throw new IllegalArgumentException("Both endpoints must exist: " + a + " - " + b);
        }
        if (a.equals(b)) {
            return;
        }
        EdgeKey key = EdgeKey.of(a, b);
        if (edges.containsKey(key)) {
            return;
        }
        edges.put(key, GraphSnapshot.Edge.builder().source(a).target(b).relation(relation).build());
        adjacency.get(a).add(b);
        adjacency.get(b).add(a);
    }

    public Set<String> neighbors(String id) {
        Set<String> adjacent = adjacency.get(id);
        return adjacent != null ? Collections.unmodifiableSet(adjacent) : Set.of();
    }

    /**
     * Minimum number of edges between two nodes, or empty when either node is
     * absent or they are disconnected.
     */
    public OptionalInt shortestPathLength(String from, String to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            return OptionalInt.empty();
        }
        if (from.equals(to)) {
            return OptionalInt.of(0);
        }
        Map<String, Integer> distance = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distance.put(from, 0);
        queue.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = distance.get(current) + 1;
            for (String neighbor : adjacency.get(current)) {
                if (distance.containsKey(neighbor)) {
                    continue;
                }
                if (neighbor.equals(to)) {
                    return OptionalInt.of(next);
                }
                distance.put(neighbor, next);
                queue.add(neighbor);
            }
        }
        return OptionalInt.empty();
    }

    public List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<String> nodeIdsOfType(NodeType type) {
        List<String> result = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (node.getType() == type) {
                result.add(node.getId());
            }
        }
        return result;
    }

    public List<GraphNode> nodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<GraphSnapshot.Edge> edges() {
        return new ArrayList<>(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    private record EdgeKey(String first, String second) {
        static EdgeKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new EdgeKey(a, b) : new EdgeKey(b, a);
        }
    }
}
