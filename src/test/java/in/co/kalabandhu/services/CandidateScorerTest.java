package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.KeywordMatch;
import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchType;
import in.co.kalabandhu.pojos.QueryAnalysis;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateScorerTest {

    private QueryAnalyzer analyzer;
    private CandidateScorer scorer;

    @BeforeEach
    void setUp() {
        SynonymTables tables = SynonymTablesLoader.loadDefault();
        analyzer = new QueryAnalyzer(tables);
        scorer = new CandidateScorer(tables);
    }

    @AfterEach
    void tearDown() {
        // Clear a flag left by the cancellation test
        Thread.interrupted();
    }

    private ScoredCandidate score(String query, CandidateProfile candidate, MatchOptions options) {
        return scorer.score(candidate, 0, analyzer.analyze(query), options);
    }

    private static KeywordMatch professionSignal(ScoredCandidate scored) {
        for (KeywordMatch match : scored.matches) {
            if (match.field == MatchField.PROFESSION) {
                return match;
            }
        }
        return null;
    }

    @Test
    void test_canonicalProfession_scoresExactWeight() {
        // Arrange
        CandidateProfile potter = CandidateProfile.builder().id("a1").profession("Pottery").build();

        // Act
        ScoredCandidate scored = score("pottery", potter, MatchOptions.defaults());

        // Assert
        KeywordMatch signal = professionSignal(scored);
        assertNotNull(signal);
        assertEquals(MatchType.EXACT, signal.matchType);
        assertEquals(0.40, signal.score, 1e-9);
        assertEquals(0.40, scored.score, 1e-9);
        assertTrue(scored.hasExactProfessionMatch());
    }

    @Test
    void test_turkishDefaultLocale_uppercaseProfessionStillMatches() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // Arrange: dotted I lowercases to a dotless i under tr-TR
            SynonymTables tables = SynonymTablesLoader.loadDefault();
            QueryAnalyzer turkishAnalyzer = new QueryAnalyzer(tables);
            CandidateScorer turkishScorer = new CandidateScorer(tables);
            CandidateProfile painter = CandidateProfile.builder().id("a2").profession("PAINTING").build();

            for (String query : List.of("painting", "PAINTING")) {
                // Act
                ScoredCandidate scored = turkishScorer.score(painter, 0, turkishAnalyzer.analyze(query),
                        MatchOptions.defaults());

                // Assert
                KeywordMatch signal = professionSignal(scored);
                assertNotNull(signal, query);
                assertEquals(MatchType.EXACT, signal.matchType, query);
                assertEquals(0.40, signal.score, 1e-9, query);
                assertTrue(scored.hasMatchOn(MatchField.PROFESSION), query);
            }
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void test_synonymQuery_scoresSynonymWeight() {
        CandidateProfile potter = CandidateProfile.builder().id("a1").profession("Pottery").build();

        ScoredCandidate viaSynonym = score("ceramic work", potter, MatchOptions.defaults());
        ScoredCandidate viaCanonical = score("pottery", potter, MatchOptions.defaults());

        KeywordMatch signal = professionSignal(viaSynonym);
        assertNotNull(signal);
        assertEquals(MatchType.SYNONYM, signal.matchType);
        assertEquals(0.30, signal.score, 1e-9);
        assertTrue(viaSynonym.hasMatchOn(MatchField.PROFESSION));
        assertTrue(viaSynonym.score < viaCanonical.score);
    }

    @Test
    void test_candidateProfessionIsSynonym_scoresSynonymWeight() {
        CandidateProfile carpenter = CandidateProfile.builder().id("c1").profession("Master Carpenter").build();

        ScoredCandidate scored = score("woodworking", carpenter, MatchOptions.defaults());

        KeywordMatch signal = professionSignal(scored);
        assertNotNull(signal);
        assertEquals("carpenter", signal.keyword);
        assertEquals(0.30, signal.score, 1e-9);
    }

    @Test
    void test_productInferredProfession_matches() {
        CandidateProfile woodworker = CandidateProfile.builder()
                .id("w1")
                .profession("woodworking")
                .materials("Teak", "Wood")
                .build();

        ScoredCandidate scored = score("wooden chair", woodworker, MatchOptions.defaults());

        assertTrue(scored.hasMatchOn(MatchField.PROFESSION));
        assertTrue(scored.hasMatchOn(MatchField.MATERIAL));
        assertEquals(0.30 + 0.20, scored.score, 1e-9);
    }

    @Test
    void test_allSignals_sumAndClampToOne() {
        CandidateProfile potter = CandidateProfile.builder()
                .id("p1")
                .profession("Pottery")
                .skills("Pottery", "Wheel throwing")
                .specializations("Blue pottery")
                .description("Hand thrown pottery and pot making")
                .build();

        ScoredCandidate plain = score("pottery", potter, MatchOptions.defaults());
        ScoredCandidate boosted = score("pottery", potter, MatchOptions.defaults().withBoostExactMatches(true));

        // 0.40 profession + 2 x 0.15 skill + 2 x 0.10 specialization + 2 x 0.05 description
        assertEquals(1.0, plain.score, 1e-9);
        assertEquals(1.0, boosted.score, 1e-9);
    }

    @Test
    void test_boostExactMatches_multipliesExactProfession() {
        CandidateProfile potter = CandidateProfile.builder().id("a1").profession("Pottery").build();

        ScoredCandidate boosted = score("pottery", potter, MatchOptions.defaults().withBoostExactMatches(true));

        assertEquals(0.48, boosted.score, 1e-9);
    }

    @Test
    void test_boostExactMatches_ignoredForSynonymHit() {
        CandidateProfile potter = CandidateProfile.builder().id("a1").profession("Pottery").build();

        ScoredCandidate boosted = score("ceramic work", potter, MatchOptions.defaults().withBoostExactMatches(true));

        assertEquals(0.30, boosted.score, 1e-9);
    }

    @Test
    void test_techniqueAndMaterial_signals() {
        CandidateProfile carver = CandidateProfile.builder()
                .id("k1")
                .profession("Sculptor")
                .materials("Sandstone")
                .techniques("Relief carving")
                .build();

        ScoredCandidate scored = score("stone carving", carver, MatchOptions.defaults());

        assertTrue(scored.hasMatchOn(MatchField.MATERIAL));
        assertTrue(scored.hasMatchOn(MatchField.TECHNIQUE));
        assertFalse(scored.hasMatchOn(MatchField.PROFESSION));
        assertEquals(0.40, scored.score, 1e-9);
    }

    @Test
    void test_nullFields_scoreZeroWithoutError() {
        CandidateProfile empty = new CandidateProfile();

        ScoredCandidate scored = score("pottery", empty, MatchOptions.defaults());

        assertEquals(0.0, scored.score);
        assertTrue(scored.matches.isEmpty());
    }

    @Test
    void test_blankListEntries_doNotMatchEverything() {
        CandidateProfile candidate = CandidateProfile.builder()
                .id("b1")
                .skills(Arrays.asList("", " ", null))
                .build();

        ScoredCandidate scored = score("pottery", candidate, MatchOptions.defaults());

        assertEquals(0.0, scored.score);
    }

    @Test
    void test_scoreAll_skipsNullCandidatesAndKeepsIndex() {
        List<CandidateProfile> candidates = new ArrayList<>();
        candidates.add(null);
        candidates.add(CandidateProfile.builder().id("a1").profession("Pottery").build());

        List<ScoredCandidate> scored = scorer.scoreAll(candidates, analyzer.analyze("pottery"), null);

        assertEquals(1, scored.size());
        assertEquals(1, scored.get(0).originalIndex);
    }

    @Test
    void test_scoreAll_interrupted_throwsCancelled() {
        List<CandidateProfile> candidates = List.of(CandidateProfile.builder().id("a1").build());
        QueryAnalysis analysis = analyzer.analyze("pottery");

        Thread.currentThread().interrupt();

        assertThrows(MatchCancelledException.class, () -> scorer.scoreAll(candidates, analysis, null));
    }

    @Test
    void test_locationMatches() {
        CandidateProfile jaipur = CandidateProfile.builder().location("Jaipur, Rajasthan").build();

        assertTrue(CandidateScorer.locationMatches(jaipur, null));
        assertTrue(CandidateScorer.locationMatches(jaipur, "rajasthan"));
        assertFalse(CandidateScorer.locationMatches(jaipur, "Kutch"));
        assertFalse(CandidateScorer.locationMatches(new CandidateProfile(), "Kutch"));
    }
}
