package me.golemcore.careergraph.domain.service;

import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.KnowledgeGraph;
import me.golemcore.careergraph.domain.model.AnomalyReport;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.testsupport.GraphStates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static me.golemcore.careergraph.domain.service.AnomalyService.DEFAULT_MAX_DEPTH;
import static me.golemcore.careergraph.domain.service.AnomalyService.DEFAULT_SIM_THRESHOLD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnomalyServiceTest {

    private GraphState state;
    private AnomalyService service;

    @BeforeEach
    void setUp() {
        state = GraphState.empty(EmbeddingSpace.TEXT, 3);
        KnowledgeGraph graph = state.getGraph();
        graph.addNode("skill_Python", NodeType.SKILL, Map.of());
        graph.addNode("skill_Cobol", NodeType.SKILL, Map.of());
        graph.addNode("job_1", NodeType.JOB, Map.of());
        graph.addNode("company_Acme", NodeType.COMPANY, Map.of());
        graph.addEdge("job_1", "skill_Python");
        graph.addEdge("job_1", "company_Acme");
        state.putEmbedding("skill_Python", new float[] { 1, 0, 0 });
        state.putEmbedding("skill_Cobol", new float[] { 0, 0, 1 });
        state.putEmbedding("job_1", new float[] { 1, 1, 0 });
        state.putEmbedding("company_Acme", new float[] { 0, 1, 0 });
        service = new AnomalyService(GraphStates.holder(state), new MatchScoringService());
    }

    @Test
    void shouldReportConnectedSkillForRequiringJob() {
        AnomalyReport report = service.checkAnomaly("Python", "1", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD);

        assertEquals("skill_Python", report.getSkill());
        assertEquals("job_1", report.getTargetNode());
        assertEquals(1, report.getPathLength());
        assertEquals(1 / Math.sqrt(2), report.getSimilarity(), 1e-6);
        assertTrue(report.isConnected());
        assertFalse(report.isAnomaly());
    }

    @Test
    void shouldFlagDisconnectedSkill() {
        AnomalyReport report = service.checkAnomaly("skill_Cobol", "1", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD);

        assertNull(report.getPathLength());
        assertTrue(report.isAnomaly());
    }

    @Test
    void shouldFallBackToCompanyTarget() {
        AnomalyReport strict = service.checkAnomaly("Python", "Acme", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD);
        AnomalyReport lenient = service.checkAnomaly("Python", "Acme", DEFAULT_MAX_DEPTH, -1.0);

        assertEquals("company_Acme", strict.getTargetNode());
        assertEquals(2, strict.getPathLength());
        assertTrue(strict.isAnomaly());
        assertTrue(lenient.isConnected());
    }

    @Test
    void shouldPreferJobOverCompanyWithSameKey() {
        state.getGraph().addNode("job_Acme", NodeType.JOB, Map.of());

        AnomalyReport report = service.checkAnomaly("Python", "Acme", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD);

        assertEquals("job_Acme", report.getTargetNode());
        assertTrue(report.isAnomaly());
    }

    @Test
    void shouldAcceptExplicitTargetIds() {
        AnomalyReport report = service.checkAnomaly("Python", "company_Acme", 1, -1.0);

        assertEquals("company_Acme", report.getTargetNode());
        assertTrue(report.isAnomaly());
    }

    @Test
    void shouldFlagPathsLongerThanMaxDepth() {
        AnomalyReport report = service.checkAnomaly("Python", "1", 0, DEFAULT_SIM_THRESHOLD);

        assertTrue(report.isAnomaly());
        assertEquals(1, report.getPathLength());
    }

    @Test
    void shouldReportUnknownNodesAsNotFound() {
        GraphException skill = assertThrows(GraphException.class,
                () -> service.checkAnomaly("Haskell", "1", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD));
        GraphException target = assertThrows(GraphException.class,
                () -> service.checkAnomaly("Python", "Initech", DEFAULT_MAX_DEPTH, DEFAULT_SIM_THRESHOLD));

        assertEquals(GraphErrorKind.NOT_FOUND, skill.getKind());
        assertEquals(GraphErrorKind.NOT_FOUND, target.getKind());
    }

    @Test
    void shouldRejectNegativeDepth() {
        assertThrows(IllegalArgumentException.class,
                () -> service.checkAnomaly("Python", "1", -1, DEFAULT_SIM_THRESHOLD));
    }
}
