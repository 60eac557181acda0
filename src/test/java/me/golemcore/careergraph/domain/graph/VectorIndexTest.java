package me.golemcore.careergraph.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorIndexTest {

    @Test
    void shouldReturnNothingFromEmptyIndex() {
        VectorIndex index = new VectorIndex(3);

        assertTrue(index.search(new float[] { 1, 0, 0 }, 5).isEmpty());
    }

    @Test
    void shouldRankByCosineSimilarity() {
        VectorIndex index = new VectorIndex(2);
        index.add("a", new float[] { 0, 5 });
        index.add("b", new float[] { 10, 0 });
        index.add("c", new float[] { 1, 1 });

        List<VectorIndex.Hit> hits = index.search(new float[] { 3, 0 }, 2);

        assertEquals(2, hits.size());
        assertEquals("b", hits.get(0).id());
        assertEquals(1.0, hits.get(0).score(), 1e-6);
        assertEquals("c", hits.get(1).id());
        assertEquals(Math.sqrt(0.5), hits.get(1).score(), 1e-6);
    }

    @Test
    void shouldBreakTiesByInsertionOrder() {
        VectorIndex index = new VectorIndex(2);
        index.add("first", new float[] { 1, 1 });
        index.add("second", new float[] { 1, 1 });
        index.add("third", new float[] { 1, 1 });

        List<VectorIndex.Hit> hits = index.search(new float[] { 1, 1 }, 3);

        assertEquals(List.of("first", "second", "third"), hits.stream().map(VectorIndex.Hit::id).toList());
    }

    @Test
    void shouldReplaceVectorOfExistingIdInPlace() {
        VectorIndex index = new VectorIndex(2);
        index.add("a", new float[] { 1, 0 });
        index.add("b", new float[] { 0, 1 });
        index.add("a", new float[] { 0, 1 });

        assertEquals(List.of("a", "b"), index.ids());
        assertEquals(1.0, index.search(new float[] { 0, 1 }, 1).get(0).score(), 1e-6);
    }

    @Test
    void shouldGrowBeyondInitialCapacity() {
        Map<String, float[]> vectors = new LinkedHashMap<>();
        for (int i = 0; i < 100; i++) {
            vectors.put("n" + i, new float[] { i + 1, 1 });
        }

        VectorIndex index = VectorIndex.build(2, vectors);

        assertEquals(100, index.size());
        assertEquals("n99", index.search(new float[] { 1, 0 }, 1).get(0).id());
    }

    @Test
    void shouldRejectWrongDimension() {
        VectorIndex index = new VectorIndex(3);

        assertThrows(IllegalArgumentException.class, () -> index.add("a", new float[] { 1, 2 }));
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[] { 1 }, 1));
    }
}
