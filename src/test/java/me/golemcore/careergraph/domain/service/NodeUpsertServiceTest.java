package me.golemcore.careergraph.domain.service;

import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.graph.VectorMath;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.NodeId;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.UpsertCommand;
import me.golemcore.careergraph.domain.model.UpsertResult;
import me.golemcore.careergraph.port.outbound.EmbeddingPort;
import me.golemcore.careergraph.testsupport.GraphStates;
import me.golemcore.careergraph.testsupport.VocabularyEmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class NodeUpsertServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T10:00:00Z");

    private GraphStateHolder holder;
    private VocabularyEmbeddingPort encoder;
    private GraphSnapshotRepository repository;
    private NodeUpsertService service;

    @BeforeEach
    void setUp() {
        holder = GraphStates.emptyTextHolder();
        encoder = new VocabularyEmbeddingPort();
        repository = mock(GraphSnapshotRepository.class);
        service = newService(holder, encoder);
    }

    @Test
    void shouldCreateNodeAndAutoCreateMissingNeighbors() {
        UpsertResult result = service.addNode("job_1", "job", List.of("skill_Python", "company_Acme"),
                Map.of("title", "Backend Engineer"));

        assertEquals(UpsertResult.Status.OK, result.getStatus());
        assertEquals("job_1", result.getNode());
        assertEquals(List.of("skill_Python", "company_Acme"), result.getCreatedNodes());
        holder.read(state -> {
            assertEquals(Set.of("skill_Python", "company_Acme"), state.getGraph().neighbors("job_1"));
            assertEquals(NodeType.COMPANY, state.getGraph().getNode("company_Acme").orElseThrow().getType());
            assertTrue(state.getEmbeddings().contains("job_1"));
            assertFalse(state.getEmbeddings().contains("skill_Python"));
            assertTrue(state.getIndex().contains("job_1"));
            assertEquals(3, state.getUpdateLog().size());
            assertEquals(FIXED_NOW, state.getUpdateLog().get(0).getTimestamp());
            return null;
        });
        verify(repository).saveSnapshot(any(GraphState.class));
        verify(repository).appendUpdateLog(anyList());
    }

    @Test
    void shouldReportExistsOnSecondAddWithoutChangingState() {
        service.addNode("job_1", "job", List.of("skill_Python"), Map.of("title", "Original"));
        float[] before = holder.read(state -> state.getEmbeddings().get("job_1").orElseThrow());

        UpsertResult second = service.addNode("job_1", "job", List.of("skill_Go"), Map.of("title", "Changed"));

        assertEquals(UpsertResult.Status.EXISTS, second.getStatus());
        holder.read(state -> {
            assertEquals(2, state.getGraph().nodeCount());
            assertEquals(1, state.getGraph().edgeCount());
            assertEquals("Original", state.getGraph().getNode("job_1").orElseThrow().getMetadata().get("title"));
            assertArrayEquals(before, state.getEmbeddings().get("job_1").orElseThrow());
            assertEquals(1, state.getIndex().size());
            assertEquals(2, state.getUpdateLog().size());
            return null;
        });
        verify(repository, times(1)).saveSnapshot(any(GraphState.class));
    }

    @Test
    void shouldRejectUnknownNodeType() {
        GraphException ex = assertThrows(GraphException.class,
                () -> service.addNode("recruiter_1", "recruiter", List.of(), Map.of()));

        assertEquals(GraphErrorKind.INVALID_TYPE, ex.getKind());
        assertEquals(0, (int) holder.read(state -> state.getGraph().nodeCount()));
    }

    @Test
    void shouldRejectIdWhosePrefixContradictsType() {
        GraphException ex = assertThrows(GraphException.class,
                () -> service.addNode("job_1", "skill", List.of(), Map.of()));

        assertEquals(GraphErrorKind.INVALID_TYPE, ex.getKind());
    }

    @Test
    void shouldUseTextVectorWhenNoNeighborHasEmbedding() {
        service.addNode("candidate_A1", "candidate", List.of("skill_Python"), Map.of("name", "Ann"));

        float[] expected = encoder.embed("candidate_A1 Ann").join();
        assertArrayEquals(expected, holder.read(state -> state.getEmbeddings().get("candidate_A1").orElseThrow()));
    }

    @Test
    void shouldBlendNeighborCentroidWithTextVector() {
        service.addNode("skill_Python", "skill", List.of(), Map.of());
        service.addNode("skill_SQL", "skill", List.of(), Map.of());

        service.addNode("candidate_A1", "candidate", List.of("skill_Python", "skill_SQL"), Map.of());

        float[] python = encoder.embed("skill_Python").join();
        float[] sql = encoder.embed("skill_SQL").join();
        float[] text = encoder.embed("candidate_A1").join();
        float[] expected = VectorMath.blend(VectorMath.mean(List.of(python, sql)), 0.6, text, 0.4);
        assertArrayEquals(expected, holder.read(state -> state.getEmbeddings().get("candidate_A1").orElseThrow()),
                1e-6f);
    }

    @Test
    void shouldCreateSeedNodesWithOwnEmbeddings() {
        NodeId skill = NodeId.of(NodeType.SKILL, "Go");
        UpsertCommand command = UpsertCommand.builder()
                .node(NodeId.of(NodeType.JOB, "7"))
                .metadataEntry("title", "Gopher")
                .seed(new UpsertCommand.SeedNode(skill, Map.of(), "skill_Go"))
                .neighbor(skill)
                .build();

        UpsertResult result = service.upsert(command);

        assertEquals(List.of("skill_Go"), result.getCreatedNodes());
        float[] seedVector = encoder.embed("skill_Go").join();
        float[] text = encoder.embed("job_7 Gopher").join();
        holder.read(state -> {
            assertArrayEquals(seedVector, state.getEmbeddings().get("skill_Go").orElseThrow());
            assertArrayEquals(VectorMath.blend(seedVector, 0.6, text, 0.4),
                    state.getEmbeddings().get("job_7").orElseThrow(), 1e-6f);
            return null;
        });
    }

    @Test
    void shouldUseNeighborCentroidInStructuralSpace() {
        GraphState structural = GraphState.empty(EmbeddingSpace.STRUCTURAL, 4);
        structural.getGraph().addNode("skill_Python", NodeType.SKILL, Map.of());
        structural.putEmbedding("skill_Python", new float[] { 1, 2, 3, 4 });
        GraphStateHolder structuralHolder = GraphStates.holder(structural);
        EmbeddingPort unusedEncoder = mock(EmbeddingPort.class);
        NodeUpsertService structuralService = newService(structuralHolder, unusedEncoder);

        structuralService.addNode("candidate_A1", "candidate", List.of("skill_Python"), Map.of());
        structuralService.addNode("candidate_A2", "candidate", List.of(), Map.of());

        structuralHolder.read(state -> {
            assertArrayEquals(new float[] { 1, 2, 3, 4 }, state.getEmbeddings().get("candidate_A1").orElseThrow());
            float[] random = state.getEmbeddings().get("candidate_A2").orElseThrow();
            assertEquals(4, random.length);
            for (float v : random) {
                assertTrue(Math.abs(v) < 0.1f);
            }
            return null;
        });
        verifyNoInteractions(unusedEncoder);
    }

    @Test
    void shouldKeepIndexAlignedWithEmbeddings() {
        service.addNode("skill_Python", "skill", List.of(), Map.of());
        service.addNode("job_1", "job", List.of("skill_Python", "skill_Go"), Map.of());
        service.addNode("candidate_A1", "candidate", List.of("skill_Python"), Map.of());
        service.addNode("job_1", "job", List.of(), Map.of());

        holder.read(state -> {
            Set<String> indexed = new HashSet<>(state.getIndex().ids());
            assertEquals(state.getIndex().ids().size(), indexed.size());
            assertEquals(state.getEmbeddings().asMap().keySet(), indexed);
            return null;
        });
    }

    private NodeUpsertService newService(GraphStateHolder stateHolder, EmbeddingPort embeddingPort) {
        return new NodeUpsertService(stateHolder, embeddingPort, repository, GraphStates.properties(),
                new Random(5), Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }
}
