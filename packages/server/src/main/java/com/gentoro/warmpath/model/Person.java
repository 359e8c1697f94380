package com.gentoro.warmpath.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A person in the professional network together with the raw evidence that ingestion turns into
 * relationships.
 *
 * <p>A ghost is a placeholder discovered only through evidence; it becomes verified when its owner
 * accepts an invitation. Instances are immutable, use {@link #toBuilder()} to derive a changed
 * copy. A missing trust score defaults to {@value #DEFAULT_TRUST_SCORE}.
 */
public record Person(
    String id,
    String name,
    String email,
    String company,
    String title,
    String location,
    String industry,
    List<Employment> employment,
    List<Education> education,
    List<Affiliation> affiliations,
    List<Hometown> hometowns,
    List<FamilyTie> family,
    List<SocialProfile> socialProfiles,
    List<String> skills,
    List<String> interests,
    boolean ghost,
    String ghostSource,
    Integer trustScore,
    Instant createdAt,
    Instant updatedAt) {

  public static final int DEFAULT_TRUST_SCORE = 60;

  public Person {
    Objects.requireNonNull(id, "id");
    name = name == null ? "" : name;
    employment = employment == null ? List.of() : List.copyOf(employment);
    education = education == null ? List.of() : List.copyOf(education);
    affiliations = affiliations == null ? List.of() : List.copyOf(affiliations);
    hometowns = hometowns == null ? List.of() : List.copyOf(hometowns);
    family = family == null ? List.of() : List.copyOf(family);
    socialProfiles = socialProfiles == null ? List.of() : List.copyOf(socialProfiles);
    skills = skills == null ? List.of() : List.copyOf(skills);
    interests = interests == null ? List.of() : List.copyOf(interests);
    trustScore =
        trustScore == null ? DEFAULT_TRUST_SCORE : Math.max(0, Math.min(100, trustScore));
  }

  public boolean verified() {
    return !ghost;
  }

  public static Builder builder(String id, String name) {
    return new Builder(id, name);
  }

  public Builder toBuilder() {
    Builder b = new Builder(id, name);
    b.email = email;
    b.company = company;
    b.title = title;
    b.location = location;
    b.industry = industry;
    b.employment.addAll(employment);
    b.education.addAll(education);
    b.affiliations.addAll(affiliations);
    b.hometowns.addAll(hometowns);
    b.family.addAll(family);
    b.socialProfiles.addAll(socialProfiles);
    b.skills.addAll(skills);
    b.interests.addAll(interests);
    b.ghost = ghost;
    b.ghostSource = ghostSource;
    b.trustScore = trustScore;
    b.createdAt = createdAt;
    b.updatedAt = updatedAt;
    return b;
  }

  public static final class Builder {
    private final String id;
    private String name;
    private String email;
    private String company;
    private String title;
    private String location;
    private String industry;
    private final List<Employment> employment = new ArrayList<>();
    private final List<Education> education = new ArrayList<>();
    private final List<Affiliation> affiliations = new ArrayList<>();
    private final List<Hometown> hometowns = new ArrayList<>();
    private final List<FamilyTie> family = new ArrayList<>();
    private final List<SocialProfile> socialProfiles = new ArrayList<>();
    private final List<String> skills = new ArrayList<>();
    private final List<String> interests = new ArrayList<>();
    private boolean ghost;
    private String ghostSource;
    private int trustScore = DEFAULT_TRUST_SCORE;
    private Instant createdAt;
    private Instant updatedAt;

    private Builder(String id, String name) {
      this.id = id;
      this.name = name;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder company(String company) {
      this.company = company;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public Builder industry(String industry) {
      this.industry = industry;
      return this;
    }

    public Builder employment(Employment e) {
      this.employment.add(e);
      return this;
    }

    public Builder education(Education e) {
      this.education.add(e);
      return this;
    }

    public Builder affiliation(Affiliation a) {
      this.affiliations.add(a);
      return this;
    }

    public Builder hometown(Hometown h) {
      this.hometowns.add(h);
      return this;
    }

    public Builder family(FamilyTie f) {
      this.family.add(f);
      return this;
    }

    public Builder socialProfile(SocialProfile s) {
      this.socialProfiles.add(s);
      return this;
    }

    public Builder skill(String skill) {
      this.skills.add(skill);
      return this;
    }

    public Builder interest(String interest) {
      this.interests.add(interest);
      return this;
    }

    public Builder ghost(boolean ghost) {
      this.ghost = ghost;
      return this;
    }

    public Builder ghostSource(String ghostSource) {
      this.ghostSource = ghostSource;
      return this;
    }

    public Builder trustScore(int trustScore) {
      this.trustScore = trustScore;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Person build() {
      return new Person(
          id,
          name,
          email,
          company,
          title,
          location,
          industry,
          employment,
          education,
          affiliations,
          hometowns,
          family,
          socialProfiles,
          skills,
          interests,
          ghost,
          ghostSource,
          trustScore,
          createdAt,
          updatedAt);
    }
  }
}
