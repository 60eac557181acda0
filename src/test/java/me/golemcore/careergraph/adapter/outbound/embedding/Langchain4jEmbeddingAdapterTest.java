package me.golemcore.careergraph.adapter.outbound.embedding;

import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jEmbeddingAdapterTest {

    @Test
    void shouldReturnEmptyBatchWithoutLoadingModel() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new CareerGraphProperties());

        List<float[]> vectors = adapter.embedBatch(List.of()).join();

        assertTrue(vectors.isEmpty());
    }
}
