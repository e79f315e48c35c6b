package in.co.kalabandhu.pojos;

/**
 * One ranked candidate in a match run.
 */
public class MatchResult {
    private final CandidateProfile candidate;
    private final double relevanceScore;
    private final boolean professionMatch;
    private final boolean materialMatch;
    private final boolean techniqueMatch;
    private final boolean specializationMatch;
    private final boolean locationMatch;
    private final MatchExplanation explanation;
    private int rank;   // assigned by ResultAssembler, 0 until then

    public MatchResult(CandidateProfile candidate, double relevanceScore,
                       boolean professionMatch, boolean materialMatch, boolean techniqueMatch,
                       boolean specializationMatch, boolean locationMatch,
                       MatchExplanation explanation) {
        this.candidate = candidate;
        this.relevanceScore = Double.isNaN(relevanceScore) ? 0.0 : Math.max(0.0, Math.min(1.0, relevanceScore));
        this.professionMatch = professionMatch;
        this.materialMatch = materialMatch;
        this.techniqueMatch = techniqueMatch;
        this.specializationMatch = specializationMatch;
        this.locationMatch = locationMatch;
        this.explanation = explanation;
    }

    public CandidateProfile getCandidate() { return candidate; }
    public double getRelevanceScore() { return relevanceScore; }
    public boolean isProfessionMatch() { return professionMatch; }
    public boolean isMaterialMatch() { return materialMatch; }
    public boolean isTechniqueMatch() { return techniqueMatch; }
    public boolean isSpecializationMatch() { return specializationMatch; }
    public boolean isLocationMatch() { return locationMatch; }
    public MatchExplanation getExplanation() { return explanation; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }
}
