package me.golemcore.careergraph.domain.service;

import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.graph.GraphState;
import me.golemcore.careergraph.domain.graph.GraphStateHolder;
import me.golemcore.careergraph.domain.model.CandidateRanking;
import me.golemcore.careergraph.domain.model.EmbeddingSpace;
import me.golemcore.careergraph.domain.model.MatchEvaluation;
import me.golemcore.careergraph.domain.model.NodeType;
import me.golemcore.careergraph.domain.model.RankedCandidate;
import me.golemcore.careergraph.domain.model.SearchHit;
import me.golemcore.careergraph.port.outbound.EmbeddingPort;
import me.golemcore.careergraph.testsupport.GraphStates;
import me.golemcore.careergraph.testsupport.VocabularyEmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MatchServiceTest {

    private GraphStateHolder holder;
    private VocabularyEmbeddingPort encoder;
    private ExplanationService explanationService;
    private IngestionService ingestionService;
    private MatchService service;

    @BeforeEach
    void setUp() {
        holder = GraphStates.emptyTextHolder();
        encoder = new VocabularyEmbeddingPort();
        explanationService = mock(ExplanationService.class);
        NodeUpsertService upsertService = new NodeUpsertService(holder, encoder,
                mock(GraphSnapshotRepository.class), GraphStates.properties(), new Random(3), Clock.systemUTC());
        ingestionService = new IngestionService(new DocumentParser(), upsertService);
        service = new MatchService(holder, new MatchScoringService(), explanationService, encoder);
    }

    @Test
    void shouldEvaluateOverlapAndMissingSkills() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python, Go");
        ingestionService.ingestCandidate("A1", "Ann", null, null, "Skills: Python, SQL");

        MatchEvaluation evaluation = service.evaluateMatch("job_1", "candidate_A1", false);

        assertEquals(0.5, evaluation.getGraphScore(), 1e-9);
        assertEquals(List.of("Python", "Go"), evaluation.getJobSkills());
        assertEquals(List.of("Python", "SQL"), evaluation.getCandidateSkills());
        assertEquals(List.of("Go"), evaluation.getMissingSkills());
        assertTrue(evaluation.getEmbeddingSimilarity() > 0.0);
        assertEquals(0.5 * evaluation.getGraphScore() + 0.5 * evaluation.getEmbeddingSimilarity(),
                evaluation.getFinalScore(), 1e-9);
        assertNull(evaluation.getExplanation());
        verifyNoInteractions(explanationService);
    }

    @Test
    void shouldAttachExplanationWhenRequested() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python");
        ingestionService.ingestCandidate("A1", "Ann", null, null, "Skills: Python");
        when(explanationService.explainMatch(any(MatchEvaluation.class))).thenReturn("Strong fit.");

        MatchEvaluation evaluation = service.evaluateMatch("job_1", "candidate_A1", true);

        assertEquals("Strong fit.", evaluation.getExplanation());
        assertEquals(1.0, evaluation.getGraphScore(), 1e-9);
    }

    @Test
    void shouldReportMissingNodesAsNotFound() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python");

        GraphException ex = assertThrows(GraphException.class,
                () -> service.evaluateMatch("job_1", "candidate_ghost", false));

        assertEquals(GraphErrorKind.NOT_FOUND, ex.getKind());
        assertThrows(GraphException.class, () -> service.rankCandidates("job_ghost", List.of(), null, false));
    }

    @Test
    void shouldRankCandidatesBestFirstAndApplyTopN() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python, Go");
        ingestionService.ingestCandidate("A1", "Ann", null, null, "Skills: Python, SQL");
        ingestionService.ingestCandidate("A2", "Bob", null, null, "Skills: Python, Go");

        CandidateRanking all = service.rankCandidates("job_1",
                List.of("candidate_A1", "candidate_A2", "candidate_ghost"), null, false);
        CandidateRanking top = service.rankCandidates("job_1", List.of("candidate_A1", "candidate_A2"), 1, false);

        assertEquals(List.of("candidate_A2", "candidate_A1"), candidates(all));
        assertEquals(1.0, all.getRanked().get(0).getGraphScore(), 1e-9);
        assertEquals(List.of("candidate_A2"), candidates(top));
        assertNull(all.getExplanation());
    }

    @Test
    void shouldKeepInputOrderForEqualScores() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Rust");
        ingestionService.ingestCandidate("B", null, null, null, "Skills: Cobol");
        ingestionService.ingestCandidate("A", null, null, null, "Skills: Cobol");
        holder.write(state -> {
            float[] same = state.getEmbeddings().get("candidate_A").orElseThrow();
            state.putEmbedding("candidate_B", same);
            return null;
        });

        CandidateRanking ranking = service.rankCandidates("job_1", List.of("candidate_B", "candidate_A"), null,
                false);

        assertEquals(List.of("candidate_B", "candidate_A"), candidates(ranking));
    }

    @Test
    void shouldRejectNegativeTopN() {
        assertThrows(IllegalArgumentException.class,
                () -> service.rankCandidates("job_1", List.of(), -1, false));
    }

    @Test
    void shouldExplainRankingWithShownCandidatesOnly() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python, Go");
        ingestionService.ingestCandidate("A1", "Ann", null, null, "Skills: Python, SQL");
        ingestionService.ingestCandidate("A2", "Bob", null, null, "Skills: Python, Go");
        when(explanationService.explainRanking(anyList(), anyMap())).thenReturn("A2 covers everything.");

        CandidateRanking ranking = service.rankCandidates("job_1", List.of("candidate_A1", "candidate_A2"), 1,
                true);

        assertEquals("A2 covers everything.", ranking.getExplanation());
        verify(explanationService).explainRanking(List.of("Python", "Go"),
                Map.of("candidate_A2", List.of("Python", "Go")));
    }

    @Test
    void shouldNotExplainEmptyRanking() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python");

        CandidateRanking ranking = service.rankCandidates("job_1", List.of("candidate_ghost"), null, true);

        assertTrue(ranking.getRanked().isEmpty());
        verify(explanationService, never()).explainRanking(anyList(), anyMap());
    }

    @Test
    void shouldFindSkillNodeForMatchingQuery() {
        ingestionService.ingestJob("1", "Dev", "Acme", "Required skills: Python, Go");
        ingestionService.ingestCandidate("A1", "Ann", null, null, "Skills: Python, SQL");

        List<SearchHit> hits = service.searchByText("Python", 3);

        assertEquals(3, hits.size());
        assertEquals("skill_Python", hits.get(0).getNode());
        assertEquals(NodeType.SKILL, hits.get(0).getType());
        assertTrue(hits.get(0).getScore() >= hits.get(1).getScore());
    }

    @Test
    void shouldRankPythonSkillFirstForPythonDeveloperQuery() {
        NodeUpsertService upsertService = new NodeUpsertService(holder, encoder,
                mock(GraphSnapshotRepository.class), GraphStates.properties(), new Random(3), Clock.systemUTC());
        upsertService.addNode("skill_Python", "skill", List.of(), Map.of());
        upsertService.addNode("skill_Go", "skill", List.of(), Map.of());
        upsertService.addNode("skill_SQL", "skill", List.of(), Map.of());

        List<SearchHit> hits = service.searchByText("python developer", 3);

        assertEquals("skill_Python", hits.get(0).getNode());
        assertTrue(hits.get(0).getScore() > hits.get(1).getScore());
    }

    @Test
    void shouldRejectInvalidSearchArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.searchByText(" ", 3));
        assertThrows(IllegalArgumentException.class, () -> service.searchByText("Python", 0));
    }

    @Test
    void shouldReturnNothingFromSearchInStructuralSpace() {
        GraphState structural = GraphState.empty(EmbeddingSpace.STRUCTURAL, 4);
        structural.getGraph().addNode("skill_Python", NodeType.SKILL, Map.of());
        structural.putEmbedding("skill_Python", new float[] { 1, 0, 0, 0 });
        EmbeddingPort unusedEncoder = mock(EmbeddingPort.class);
        MatchService structuralService = new MatchService(GraphStates.holder(structural), new MatchScoringService(),
                explanationService, unusedEncoder);

        assertTrue(structuralService.searchByText("Python", 5).isEmpty());
        verifyNoInteractions(unusedEncoder);
    }

    private static List<String> candidates(CandidateRanking ranking) {
        return ranking.getRanked().stream().map(RankedCandidate::getCandidate).collect(Collectors.toList());
    }
}
