package me.golemcore.careergraph.testsupport;

import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.service.GraphSnapshotRepository;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;

import java.time.Duration;

import static org.mockito.Mockito.mock;

public final class GraphStates {

    private GraphStates() {
    }

    public static GraphStateHolder holder(GraphState state) {
        GraphStateHolder holder = new GraphStateHolder(mock(GraphSnapshotRepository.class));
        holder.initialize(state);
        return holder;
    }

    public static GraphStateHolder emptyTextHolder() {
        return holder(GraphState.empty(EmbeddingSpace.TEXT, VocabularyEmbeddingPort.DIMENSION));
    }

    public static CareerGraphProperties properties() {
        CareerGraphProperties properties = new CareerGraphProperties();
        properties.getPersistence().setRetryBackoff(Duration.ZERO);
        properties.getStructural().setSeed(42L);
        return properties;
    }
}
