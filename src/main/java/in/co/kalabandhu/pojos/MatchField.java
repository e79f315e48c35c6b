package in.co.kalabandhu.pojos;

/**
 * Candidate field a keyword signal fired on.
 */
public enum MatchField {
    PROFESSION,
    SKILL,
    MATERIAL,
    TECHNIQUE,
    SPECIALIZATION,
    DESCRIPTION
}
