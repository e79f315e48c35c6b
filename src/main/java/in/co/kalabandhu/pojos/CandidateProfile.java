package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * An artisan profile as loaded by the caller from the profile store.
 * The engine only reads it. Any field may be null.
 */
public class CandidateProfile {
    private String id;
    private String name;
    private String profession;          // pottery, woodworking, jewelry...
    private List<String> skills;
    private List<String> materials;     // wood, clay, silver
    private List<String> techniques;    // carving, weaving
    private List<String> specializations;
    private String description;
    private String location;            // city or district the artisan serves

    public CandidateProfile() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final CandidateProfile profile = new CandidateProfile();

        public Builder id(String id) { profile.id = id; return this; }
        public Builder name(String name) { profile.name = name; return this; }
        public Builder profession(String profession) { profile.profession = profession; return this; }
        public Builder skills(String... skills) { profile.skills = List.of(skills); return this; }
        public Builder skills(List<String> skills) { profile.skills = skills; return this; }
        public Builder materials(String... materials) { profile.materials = List.of(materials); return this; }
        public Builder materials(List<String> materials) { profile.materials = materials; return this; }
        public Builder techniques(String... techniques) { profile.techniques = List.of(techniques); return this; }
        public Builder techniques(List<String> techniques) { profile.techniques = techniques; return this; }
        public Builder specializations(String... specs) { profile.specializations = List.of(specs); return this; }
        public Builder specializations(List<String> specs) { profile.specializations = specs; return this; }
        public Builder description(String description) { profile.description = description; return this; }
        public Builder location(String location) { profile.location = location; return this; }

        public CandidateProfile build() { return profile; }
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getProfession() { return profession; }
    public void setProfession(String profession) { this.profession = profession; }

    public List<String> getSkills() { return skills; }
    public void setSkills(List<String> skills) { this.skills = skills; }

    public List<String> getMaterials() { return materials; }
    public void setMaterials(List<String> materials) { this.materials = materials; }

    public List<String> getTechniques() { return techniques; }
    public void setTechniques(List<String> techniques) { this.techniques = techniques; }

    public List<String> getSpecializations() { return specializations; }
    public void setSpecializations(List<String> specializations) { this.specializations = specializations; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
}
