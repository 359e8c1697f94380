package com.gentoro.warmpath.store;

import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import java.util.List;

/** Serialized form of a whole store, used for seed files and the file-backed driver. */
public record StoreSnapshot(
    List<Person> persons, List<Relationship> relationships, List<Invitation> invitations) {

  public StoreSnapshot {
    persons = persons == null ? List.of() : List.copyOf(persons);
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
    invitations = invitations == null ? List.of() : List.copyOf(invitations);
  }

  public static StoreSnapshot empty() {
    return new StoreSnapshot(List.of(), List.of(), List.of());
  }
}
