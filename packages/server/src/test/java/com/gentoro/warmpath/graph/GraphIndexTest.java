package com.gentoro.warmpath.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GraphIndexTest {

  private static final Person A = Person.builder("a", "Ann").build();
  private static final Person B = Person.builder("b", "Bo").build();
  private static final Person C = Person.builder("c", "Cy").build();

  private static List<Relationship> both(
      String from, String to, RelationshipType type, int strength) {
    Relationship r = new Relationship(from, to, type, strength, 100, false, Map.of());
    return List.of(r, r.reversed());
  }

  @Test
  void skipsAndCountsOrphanedEdges() {
    List<Relationship> edges = new ArrayList<>(both("a", "b", RelationshipType.COWORKER, 70));
    edges.addAll(both("a", "ghost-of-nobody", RelationshipType.SOCIAL, 40));

    GraphIndex index = GraphIndex.build(List.of(A, B, C), edges, Instant.EPOCH);

    assertEquals(3, index.nodeCount());
    assertEquals(2, index.edgeCount());
    assertEquals(2, index.orphanedEdges());
    assertEquals(1, index.neighbors("a").size());
    assertTrue(index.neighbors("c").isEmpty());
    assertTrue(index.neighbors("unknown").isEmpty());
  }

  @Test
  void strongestEdgePrefersStrengthThenTrust() {
    List<Relationship> edges = new ArrayList<>();
    edges.addAll(both("a", "b", RelationshipType.SOCIAL, 40));
    edges.addAll(both("a", "b", RelationshipType.HOMETOWN, 60));
    edges.addAll(both("a", "b", RelationshipType.EDUCATION, 60));

    GraphIndex index = GraphIndex.build(List.of(A, B), edges, null);

    assertEquals(RelationshipType.EDUCATION, index.strongestEdge("a", "b").orElseThrow().type());
    assertEquals(RelationshipType.EDUCATION, index.strongestEdge("b").orElseThrow().type());
    assertTrue(index.strongestEdge("a", "c").isEmpty());
  }

  @Test
  void withChangesReplacesEdgesByIdentity() {
    GraphIndex index =
        GraphIndex.build(List.of(A, B), both("a", "b", RelationshipType.COWORKER, 70), null);
    Relationship boosted =
        new Relationship("a", "b", RelationshipType.COWORKER, 70, 20, true, Map.of());

    GraphIndex next =
        index.withChanges(A.toBuilder().name("Ann Updated").build(), List.of(boosted));

    assertEquals(2, next.edgeCount());
    assertEquals(20, next.strongestEdge("a", "b").orElseThrow().confidence());
    assertEquals(100, next.strongestEdge("b", "a").orElseThrow().confidence());
    assertEquals("Ann Updated", next.person("a").orElseThrow().name());
    assertEquals(100, index.strongestEdge("a", "b").orElseThrow().confidence());
  }

  @Test
  void integrityReportFlagsBrokenEdgeSets() {
    Relationship oneWay = new Relationship("a", "b", RelationshipType.FAMILY, 90, 100, false, null);
    Relationship orphan = new Relationship("a", "x", RelationshipType.SOCIAL, 40, 100, false, null);

    IntegrityReport report =
        IntegrityReport.inspect(List.of(A, B, C), List.of(oneWay, oneWay, orphan));

    assertEquals(1, report.orphanedEdges());
    assertEquals(1, report.duplicateEdges());
    assertEquals(3, report.asymmetricEdges());
    assertEquals(1, report.isolatedPersons());
    assertFalse(report.healthy());
  }
}
