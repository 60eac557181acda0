package me.golemcore.careergraph.domain.service;

import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.GraphStatus;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.ReconciliationState;
import me.golemcore.careergraph.domain.model.SimilarJobsResult;
import me.golemcore.careergraph.domain.model.SimilarSkillsResult;
import me.golemcore.careergraph.domain.model.UpdateLogEntry;
import me.golemcore.careergraph.testsupport.GraphStates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GraphQueryServiceTest {

    private GraphState state;
    private GraphSnapshotRepository snapshotRepository;
    private ReconciliationService reconciliationService;
    private GraphQueryService service;

    @BeforeEach
    void setUp() {
        state = GraphState.empty(EmbeddingSpace.TEXT, 3);
        KnowledgeGraph graph = state.getGraph();
        graph.addNode("job_1", NodeType.JOB, Map.of());
        graph.addNode("job_2", NodeType.JOB, Map.of());
        graph.addNode("job_3", NodeType.JOB, Map.of());
        graph.addNode("skill_Python", NodeType.SKILL, Map.of());
        graph.addNode("skill_Django", NodeType.SKILL, Map.of());
        graph.addNode("skill_Go", NodeType.SKILL, Map.of());
        graph.addNode("skill_C++", NodeType.SKILL, Map.of());
        graph.addEdge("job_1", "skill_Python");
        graph.addEdge("job_3", "skill_Python");
        graph.addEdge("job_3", "skill_Django");
        graph.addEdge("job_2", "skill_Go");
        state.putEmbedding("job_1", new float[] { 1, 1, 0 });
        state.putEmbedding("job_2", new float[] { 0, 0, 1 });
        state.putEmbedding("job_3", new float[] { 1, 0.9f, 0 });
        state.putEmbedding("skill_Python", new float[] { 1, 0, 0 });
        state.putEmbedding("skill_Django", new float[] { 0.9f, 0.1f, 0 });
        state.putEmbedding("skill_Go", new float[] { 0, 0, 1 });
        state.recordCreated(UpdateLogEntry.builder()
                .nodeId("job_1")
                .type(NodeType.JOB)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build());

        snapshotRepository = mock(GraphSnapshotRepository.class);
        reconciliationService = mock(ReconciliationService.class);
        service = new GraphQueryService(GraphStates.holder(state), new MatchScoringService(), snapshotRepository,
                reconciliationService);
    }

    @Test
    void shouldFindMostSimilarJobsWithTheirSkills() {
        SimilarJobsResult result = service.findSimilarJobs("1", 1);

        assertEquals("job_1", result.getQueryJob());
        assertEquals(List.of("Python"), result.getSkills());
        assertEquals(List.of("job_3"), result.getSimilarJobs());
        assertEquals(Map.of("job_3", List.of("Python", "Django")), result.getSkillsOfSimilarJobs());
    }

    @Test
    void shouldNeverReturnQueryJobAsSimilar() {
        SimilarJobsResult result = service.findSimilarJobs("job_1", 10);

        assertEquals(List.of("job_3", "job_2"), result.getSimilarJobs());
    }

    @Test
    void shouldFindSimilarSkillsWithRequiringJobs() {
        SimilarSkillsResult result = service.findSimilarSkills("Python", 1);

        assertEquals("skill_Python", result.getQuerySkill());
        assertEquals(List.of("job_1", "job_3"), result.getRelatedJobs());
        assertEquals(List.of("skill_Django"), result.getSimilarSkills());
        assertEquals(Map.of("skill_Django", List.of("job_3")), result.getJobsForSimilarSkills());
    }

    @Test
    void shouldReportUnknownQueryNodeAsNotFound() {
        GraphException ex = assertThrows(GraphException.class, () -> service.findSimilarJobs("99", 3));

        assertEquals(GraphErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void shouldExtractKnownSkillsAsWholeWords() {
        List<String> skills = service.extractKnownSkills("Strong PYTHON and C++ background, going to learn Rust");

        assertEquals(List.of("c++", "python"), skills);
    }

    @Test
    void shouldExtractNothingFromBlankText() {
        assertTrue(service.extractKnownSkills("  ").isEmpty());
    }

    @Test
    void shouldExposeUpdateLogCopy() {
        List<UpdateLogEntry> log = service.updateLog();

        assertEquals(1, log.size());
        assertEquals("job_1", log.get(0).getNodeId());
    }

    @Test
    void shouldSummarizeGraphStatus() {
        when(reconciliationService.getState()).thenReturn(ReconciliationState.IDLE);
        when(snapshotRepository.isHealthy()).thenReturn(false);
        when(snapshotRepository.getFailureCount()).thenReturn(2);
        when(snapshotRepository.getLastError()).thenReturn("disk full");

        GraphStatus status = service.status();

        assertEquals(7, status.getNodes());
        assertEquals(4, status.getEdges());
        assertEquals(6, status.getEmbeddings());
        assertEquals(6, status.getIndexedVectors());
        assertEquals(EmbeddingSpace.TEXT, status.getSpace());
        assertEquals(3, status.getDimension());
        assertEquals(1, status.getPendingUpdates());
        assertEquals(ReconciliationState.IDLE, status.getReconciliationState());
        assertNull(status.getLastRebuild());
        assertFalse(status.isPersistenceHealthy());
        assertEquals(2, status.getPersistenceFailures());
        assertEquals("disk full", status.getLastPersistenceError());
    }
}
