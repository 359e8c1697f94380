package com.gentoro.warmpath.ingestion.source;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.warmpath.TestNetworks;
import com.gentoro.warmpath.ingestion.EvidenceSource;
import com.gentoro.warmpath.ingestion.RelationshipIngestionService;
import com.gentoro.warmpath.model.Affiliation;
import com.gentoro.warmpath.model.Education;
import com.gentoro.warmpath.model.Employment;
import com.gentoro.warmpath.model.FamilyTie;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.model.SocialProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Evidence sources")
class EvidenceSourcesTest {

  private final BaseConfiguration configuration = TestNetworks.configuration();

  private List<Relationship> ingest(EvidenceSource source, Person... persons) {
    return new RelationshipIngestionService(configuration, TestNetworks.CLOCK, List.of(source))
        .ingest(List.of(persons))
        .edges();
  }

  private static Optional<Relationship> edge(List<Relationship> edges, String from, String to) {
    return edges.stream()
        .filter(r -> r.fromPersonId().equals(from) && r.toPersonId().equals(to))
        .findFirst();
  }

  @Test
  @DisplayName("Coworkers whose tenures never overlapped are penalized")
  void coworkerDisjointTenure() {
    Person early =
        Person.builder("a", "Ann Early")
            .employment(new Employment("Initech LLC", "Analyst", 2005, 2008))
            .build();
    Person late =
        Person.builder("b", "Bo Late")
            .employment(new Employment("Initech", "Analyst", 2015, 2019))
            .build();

    Relationship r =
        edge(ingest(new CoworkerEvidenceSource(), early, late), "a", "b").orElseThrow();

    assertEquals(60, r.strength());
    assertFalse(r.metadata().containsKey("sharedFrom"));
  }

  @Test
  @DisplayName("Coworker overlap adds five per shared year")
  void coworkerPartialOverlap() {
    Person a =
        Person.builder("a", "Ann")
            .employment(new Employment("Hooli", "Engineer", 2010, 2014))
            .build();
    Person b =
        Person.builder("b", "Bo")
            .employment(new Employment("Hooli", "Engineer", 2014, 2016))
            .build();

    Relationship r = edge(ingest(new CoworkerEvidenceSource(), a, b), "a", "b").orElseThrow();

    assertEquals(75, r.strength());
    assertEquals(2014, r.metadata().get("sharedFrom"));
    assertEquals(2014, r.metadata().get("sharedTo"));
  }

  @Test
  @DisplayName("Alumni with different degree levels are penalized")
  void educationDegreeLevel() {
    Person bachelor =
        Person.builder("a", "Ann").education(new Education("MIT", "BS", "Physics", 2010)).build();
    Person doctor =
        Person.builder("b", "Bo")
            .education(new Education("M.I.T.", "PhD", "Biology", 2018))
            .build();

    List<Relationship> edges = ingest(new EducationEvidenceSource(), bachelor, doctor);

    // "M.I.T." and "MIT" normalize differently, so only exact school keys group
    assertTrue(edges.isEmpty());

    Person doctorSameSchool =
        Person.builder("c", "Cy").education(new Education("MIT", "PhD", "Biology", 2018)).build();
    Relationship r =
        edge(ingest(new EducationEvidenceSource(), bachelor, doctorSameSchool), "a", "c")
            .orElseThrow();
    assertEquals(50, r.strength());
  }

  @Test
  @DisplayName("Both directions of an alumni pair carry the same graduation years")
  void educationMetadataIsDirectionNeutral() {
    Person late =
        Person.builder("a", "Ann").education(new Education("MIT", "MS", "Physics", 2012)).build();
    Person early =
        Person.builder("b", "Bo").education(new Education("MIT", "MS", "Physics", 2011)).build();

    List<Relationship> edges = ingest(new EducationEvidenceSource(), late, early);

    Relationship ab = edge(edges, "a", "b").orElseThrow();
    Relationship ba = edge(edges, "b", "a").orElseThrow();
    assertEquals(List.of(2011, 2012), ab.metadata().get("graduationYears"));
    assertEquals(ab.metadata(), ba.metadata());
    assertEquals("Physics", ab.metadata().get("major"));
    assertEquals(75, ab.strength());
  }

  @Test
  @DisplayName("Members of the same chapter with overlapping years are affiliated")
  void affiliationOverlap() {
    Person a =
        Person.builder("a", "Ann")
            .affiliation(new Affiliation("Rotary Club", "Downtown", "Member", 2012, null))
            .build();
    Person b =
        Person.builder("b", "Bo")
            .affiliation(new Affiliation("rotary club", "downtown", "Chair", 2020, null))
            .build();
    Person otherChapter =
        Person.builder("c", "Cy")
            .affiliation(new Affiliation("Rotary Club", "Uptown", "Member", 2012, null))
            .build();

    List<Relationship> edges = ingest(new AffiliationEvidenceSource(), a, b, otherChapter);

    Relationship r = edge(edges, "a", "b").orElseThrow();
    assertEquals(RelationshipType.AFFILIATION, r.type());
    assertTrue(r.strength() > RelationshipType.AFFILIATION.baseStrength());
    assertTrue(edge(edges, "a", "c").isEmpty());
  }

  @Test
  @DisplayName("Declared family ties are taken at full strength")
  void declaredFamily() {
    Person a =
        Person.builder("a", "Ann Ray").family(new FamilyTie("b", "Bo Ray", "sibling")).build();
    Person b = Person.builder("b", "Bo Ray").build();
    Person unknownRelative =
        Person.builder("c", "Cy").family(new FamilyTie("missing", "Someone", "cousin")).build();

    List<Relationship> edges = ingest(new FamilyEvidenceSource(), a, b, unknownRelative);

    Relationship r = edge(edges, "b", "a").orElseThrow();
    assertEquals(90, r.strength());
    assertEquals("sibling", r.metadata().get("relation"));
    assertEquals(2, edges.size());
  }

  @Test
  @DisplayName("Social ties need an owner of the handle and mutual listing adds strength")
  void socialTies() {
    Person owner =
        Person.builder("a", "Ann")
            .socialProfile(new SocialProfile("LinkedIn", "@ann", List.of("bo")))
            .build();
    Person mutual =
        Person.builder("b", "Bo")
            .socialProfile(new SocialProfile("linkedin", "bo", List.of("ANN")))
            .build();
    Person follower =
        Person.builder("c", "Cy")
            .socialProfile(new SocialProfile("linkedin", "cy", List.of("ann", "ghosthandle")))
            .build();
    Person otherFollower =
        Person.builder("d", "Di")
            .socialProfile(new SocialProfile("linkedin", null, List.of("ghosthandle")))
            .build();

    List<Relationship> edges =
        ingest(new SocialEvidenceSource(), owner, mutual, follower, otherFollower);

    assertEquals(50, edge(edges, "a", "b").orElseThrow().strength());
    assertEquals(true, edge(edges, "a", "b").orElseThrow().metadata().get("mutual"));
    assertEquals(40, edge(edges, "a", "c").orElseThrow().strength());
    assertTrue(edge(edges, "c", "d").isEmpty(), "nobody owns ghosthandle");
  }

  @Test
  @DisplayName("Sampling an oversized social group keeps the owner of the handle")
  void socialSamplingKeepsOwner() {
    configuration.setProperty("ingestion.maxGroupSize", 3);
    List<Person> persons = new ArrayList<>();
    for (int i = 1; i <= 8; i++) {
      persons.add(
          Person.builder("f" + i, "Follower " + i)
              .socialProfile(new SocialProfile("twitter", null, List.of("zed")))
              .build());
    }
    persons.add(
        Person.builder("z", "Zed")
            .socialProfile(new SocialProfile("Twitter", "@zed", List.of()))
            .build());

    List<Relationship> edges =
        ingest(new SocialEvidenceSource(), persons.toArray(new Person[0]));

    assertEquals(6, edges.size());
    assertEquals(4, edges.stream().filter(r -> r.touches("z")).count());
  }

  @Test
  @DisplayName("Synthetic ties are reproducible for a given seed")
  void syntheticTiesAreSeeded() {
    configuration.setProperty("ingestion.sources.synthetic.enabled", true);
    configuration.setProperty("ingestion.sources.synthetic.seed", 7);
    configuration.setProperty("ingestion.sources.synthetic.socialProbability", 0.5);
    List<Person> people = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      people.add(Person.builder("p" + i, "Person " + i).build());
    }
    Person[] array = people.toArray(new Person[0]);

    List<Relationship> first = ingest(new SyntheticTiesEvidenceSource(), array);
    List<Relationship> second = ingest(new SyntheticTiesEvidenceSource(), array);

    assertFalse(first.isEmpty());
    assertEquals(first, second);
    assertTrue(first.stream().allMatch(r -> Boolean.TRUE.equals(r.metadata().get("synthetic"))));
  }
}
