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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.service.GraphSnapshotRepository;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns the process-wide {@link GraphState}. Queries run under the read lock,
 * upserts under the write lock, and a full rebuild replaces the whole state in
 * one write-locked swap, so readers see either the old state or the new one.
 */
@Component
@Slf4j
public class GraphStateHolder {

    private final GraphSnapshotRepository snapshotRepository;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile GraphState state;

    public GraphStateHolder(GraphSnapshotRepository snapshotRepository) {
        this.snapshotRepository = snapshotRepository;
    }

    @PostConstruct
    public void init() {
        initialize(snapshotRepository.load());
    }

    public void initialize(GraphState initial) {
        lock.writeLock().lock();
        try {
            this.state = initial;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Graph] Serving {} nodes, {} embeddings ({} space)",
                initial.getGraph().nodeCount(), initial.getEmbeddings().size(), initial.getSpace());
    }

    public <T> T read(Function<GraphState, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(requireState());
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Function<GraphState, T> mutation) {
        lock.writeLock().lock();
        try {
            return mutation.apply(requireState());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the current state and runs {@code afterSwap} against the new one
     * before any other reader or writer can observe it.
     *
     * @return the state that was replaced
     */
    public GraphState swap(GraphState next, Consumer<GraphState> afterSwap) {
        lock.writeLock().lock();
        try {
            GraphState previous = requireState();
            this.state = next;
            afterSwap.accept(next);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private GraphState requireState() {
        GraphState current = state;
        if (current == null) {
            throw new IllegalStateException("Graph state not initialized");
        }
        return current;
    }
}
