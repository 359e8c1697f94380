package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Consistency checks over a persisted relationship set.
 *
 * @param orphanedEdges edges referencing a person that does not exist
 * @param duplicateEdges edges repeating an already seen (from, to, type)
 * @param asymmetricEdges edges without their mirror edge
 * @param isolatedPersons persons without any edge
 */
public record IntegrityReport(
    int orphanedEdges, int duplicateEdges, int asymmetricEdges, int isolatedPersons) {

  public static IntegrityReport empty() {
    return new IntegrityReport(0, 0, 0, 0);
  }

  public boolean healthy() {
    return orphanedEdges == 0 && duplicateEdges == 0 && asymmetricEdges == 0;
  }

  public static IntegrityReport inspect(
      Collection<Person> persons, Collection<Relationship> edges) {
    Set<String> ids = new HashSet<>();
    persons.forEach(p -> ids.add(p.id()));
    Set<String> keys = new HashSet<>();
    Set<String> connected = new HashSet<>();
    int orphaned = 0;
    int duplicates = 0;
    for (Relationship r : edges) {
      if (!keys.add(r.key())) duplicates++;
      if (!ids.contains(r.fromPersonId()) || !ids.contains(r.toPersonId())) orphaned++;
      connected.add(r.fromPersonId());
      connected.add(r.toPersonId());
    }
    int asymmetric = 0;
    for (Relationship r : edges) {
      if (!keys.contains(r.toPersonId() + "|" + r.fromPersonId() + "|" + r.type())) asymmetric++;
    }
    int isolated = 0;
    for (String id : ids) {
      if (!connected.contains(id)) isolated++;
    }
    return new IntegrityReport(orphaned, duplicates, asymmetric, isolated);
  }
}
