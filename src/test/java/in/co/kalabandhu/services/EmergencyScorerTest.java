package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.ConfidenceLevel;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.pojos.MatchingTier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class EmergencyScorerTest {

    private final EmergencyScorer scorer = new EmergencyScorer(new ResultAssembler());

    private static CandidateProfile studio() {
        return CandidateProfile.builder()
                .id("e1")
                .name("Blue Pottery Studio")
                .profession("Pottery")
                .description("Hand-made vase and tableware")
                .build();
    }

    @Test
    void testMatch_ScoresProfessionNameAndDescription() {
        MatchRunResult result = scorer.match("blue pottery vase", List.of(studio()), MatchOptions.defaults(),
                System.currentTimeMillis());

        assertEquals(MatchingTier.EMERGENCY, result.getTierUsed());
        assertTrue(result.isFallbackUsed());
        assertEquals(0.1, result.getConfidence(), 1e-9);
        assertEquals(1, result.getTotalFound());

        MatchResult match = result.getMatches().get(0);
        // blue: name 0.1; pottery: profession 0.3 + name 0.1; vase: description 0.1
        assertEquals(0.6, match.getRelevanceScore(), 1e-9);
        assertTrue(match.isProfessionMatch());
        assertFalse(match.isMaterialMatch());
        assertEquals(EmergencyScorer.PRIMARY_REASON, match.getExplanation().getPrimaryReason());
        assertEquals(ConfidenceLevel.LOW, match.getExplanation().getConfidenceLevel());
        assertEquals(List.of(
                "Name contains \"blue\"",
                "Profession contains \"pottery\"",
                "Name contains \"pottery\"",
                "Description contains \"vase\""), match.getExplanation().getDetailedReasons());
    }

    @Test
    void testMatch_TurkishDefaultLocale_MatchesUppercaseText() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            CandidateProfile painter = CandidateProfile.builder()
                    .id("e2")
                    .name("INDIGO STUDIO")
                    .profession("PAINTING")
                    .build();

            MatchRunResult result = scorer.match("Painting", List.of(painter), MatchOptions.defaults(),
                    System.currentTimeMillis());

            assertEquals(1, result.getTotalFound());
            assertEquals(0.3, result.getMatches().get(0).getRelevanceScore(), 1e-9);
            assertEquals(List.of("Profession contains \"painting\""),
                    result.getMatches().get(0).getExplanation().getDetailedReasons());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testMatch_ShortWordsIgnored() {
        MatchRunResult result = scorer.match("an ox", List.of(studio()), MatchOptions.defaults(),
                System.currentTimeMillis());

        assertTrue(result.getMatches().isEmpty());
        assertTrue(result.getQueryAnalysis().getDetectedKeywords().isEmpty());
    }

    @Test
    void testMatch_RepeatedWordCountsOnce() {
        MatchRunResult once = scorer.match("pottery", List.of(studio()), MatchOptions.defaults(), 0L);
        MatchRunResult twice = scorer.match("pottery pottery", List.of(studio()), MatchOptions.defaults(), 0L);

        assertEquals(once.getMatches().get(0).getRelevanceScore(),
                twice.getMatches().get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void testMatch_ReasonsCappedAtFive() {
        CandidateProfile noisy = CandidateProfile.builder()
                .id("n1")
                .name("Clay Wood Metal")
                .profession("Clay Wood Metal")
                .description("Clay Wood Metal")
                .build();

        MatchRunResult result = scorer.match("clay wood metal", List.of(noisy), MatchOptions.defaults(), 0L);

        assertEquals(5, result.getMatches().get(0).getExplanation().getDetailedReasons().size());
        assertEquals(1.0, result.getMatches().get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void testMatch_NullCandidatesAndFieldsTolerated() {
        List<CandidateProfile> candidates = new ArrayList<>();
        candidates.add(null);
        candidates.add(new CandidateProfile());
        candidates.add(studio());

        MatchRunResult result = scorer.match("pottery", candidates, MatchOptions.defaults(), 0L);

        assertEquals(1, result.getTotalFound());
        assertEquals("e1", result.getMatches().get(0).getCandidate().getId());
    }

    @Test
    void testMatch_HonoursOptions() {
        List<CandidateProfile> candidates = List.of(studio(),
                CandidateProfile.builder().id("e2").profession("Pottery").build());

        MatchRunResult result = scorer.match("blue pottery", candidates,
                MatchOptions.defaults().withMaxResults(1).withLocation("Jaipur"), 0L);

        assertEquals(1, result.getTotalFound());
        assertEquals("e1", result.getMatches().get(0).getCandidate().getId());
        assertFalse(result.getMatches().get(0).isLocationMatch());
    }
}
