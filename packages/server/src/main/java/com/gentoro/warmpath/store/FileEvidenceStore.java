package com.gentoro.warmpath.store;

import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.utility.JacksonUtility;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evidence store persisted as a single JSON document.
 *
 * <p>Every mutation writes the complete next state to a temporary file and moves it over the
 * previous one, and only then updates memory; a failed write leaves both file and memory
 * untouched. Reads of the person and relationship lists pick up changes made to the file by other
 * processes.
 */
public class FileEvidenceStore extends InMemoryEvidenceStore {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(FileEvidenceStore.class);

  private final Path path;
  private final Object fileLock = new Object();
  private FileTime lastSeen;

  /**
   * @param path JSON file holding the store; created when missing
   * @param seedLocation optional snapshot used to populate a store whose file does not exist yet
   */
  public FileEvidenceStore(Path path, String seedLocation) {
    this.path = path.toAbsolutePath();
    synchronized (fileLock) {
      if (Files.exists(this.path)) {
        refreshIfChanged();
      } else {
        StoreSnapshot initial =
            seedLocation == null || seedLocation.isBlank()
                ? StoreSnapshot.empty()
                : SnapshotReader.read(seedLocation);
        persist(initial);
        load(initial);
        log.info(
            "Created evidence file {} with {} persons", this.path, initial.persons().size());
      }
    }
  }

  public Path path() {
    return path;
  }

  @Override
  public String driver() {
    return "file";
  }

  @Override
  public List<Person> listPersons() {
    synchronized (fileLock) {
      refreshIfChanged();
      return super.listPersons();
    }
  }

  @Override
  public List<Relationship> listEdges() {
    synchronized (fileLock) {
      refreshIfChanged();
      return super.listEdges();
    }
  }

  @Override
  public void savePerson(Person person) {
    synchronized (fileLock) {
      refreshIfChanged();
      StoreSnapshot current = snapshot();
      Map<String, Person> next = new LinkedHashMap<>();
      current.persons().forEach(p -> next.put(p.id(), p));
      next.put(person.id(), person);
      persist(
          new StoreSnapshot(
              new ArrayList<>(next.values()), current.relationships(), current.invitations()));
      super.savePerson(person);
    }
  }

  @Override
  public void replaceEdges(Collection<Relationship> edges) {
    synchronized (fileLock) {
      StoreSnapshot current = snapshot();
      persist(new StoreSnapshot(current.persons(), sorted(edges), current.invitations()));
      super.replaceEdges(edges);
    }
  }

  @Override
  public void upsertEdges(Collection<Relationship> changed) {
    synchronized (fileLock) {
      StoreSnapshot current = snapshot();
      Map<String, Relationship> next = new LinkedHashMap<>();
      current.relationships().forEach(r -> next.put(r.key(), r));
      changed.forEach(r -> next.put(r.key(), r));
      persist(
          new StoreSnapshot(current.persons(), sorted(next.values()), current.invitations()));
      super.upsertEdges(changed);
    }
  }

  @Override
  public boolean insertInvitation(Invitation invitation) {
    synchronized (fileLock) {
      if (findInvitationByToken(invitation.token()).isPresent()) {
        return false;
      }
      StoreSnapshot current = snapshot();
      List<Invitation> next = new ArrayList<>(current.invitations());
      next.add(invitation);
      persist(new StoreSnapshot(current.persons(), current.relationships(), next));
      return super.insertInvitation(invitation);
    }
  }

  @Override
  public boolean compareAndSetInvitation(
      String invitationId, InvitationStatus expected, Invitation replacement) {
    synchronized (fileLock) {
      Optional<Invitation> current = findInvitation(invitationId);
      if (current.isEmpty() || current.get().status() != expected) {
        return false;
      }
      persistInvitation(replacement);
      return super.compareAndSetInvitation(invitationId, expected, replacement);
    }
  }

  @Override
  public void recordDispatchOutcome(String invitationId, boolean emailSent, String dispatchError) {
    synchronized (fileLock) {
      Optional<Invitation> current = findInvitation(invitationId);
      if (current.isEmpty()) return;
      persistInvitation(current.get().withDispatchOutcome(emailSent, dispatchError));
      super.recordDispatchOutcome(invitationId, emailSent, dispatchError);
    }
  }

  private void persistInvitation(Invitation replacement) {
    StoreSnapshot current = snapshot();
    List<Invitation> next = new ArrayList<>();
    for (Invitation i : current.invitations()) {
      next.add(i.id().equals(replacement.id()) ? replacement : i);
    }
    persist(new StoreSnapshot(current.persons(), current.relationships(), next));
  }

  private void refreshIfChanged() {
    try {
      FileTime modified = Files.getLastModifiedTime(path);
      if (!modified.equals(lastSeen)) {
        load(SnapshotReader.read(path));
        lastSeen = modified;
      }
    } catch (NoSuchFileException e) {
      throw new EvidenceStoreException("Evidence file is missing: " + path, e);
    } catch (IOException e) {
      throw new EvidenceStoreException("Evidence file is not readable: " + path, e);
    }
  }

  private void persist(StoreSnapshot snapshot) {
    try {
      Path dir = path.getParent();
      if (dir != null) Files.createDirectories(dir);
      Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
      try {
        try (OutputStream out = Files.newOutputStream(tmp)) {
          JacksonUtility.getJsonMapper().writeValue(out, snapshot);
        }
        move(tmp);
      } finally {
        Files.deleteIfExists(tmp);
      }
      lastSeen = Files.getLastModifiedTime(path);
    } catch (IOException e) {
      throw new EvidenceStoreException("Failed to write evidence file " + path, e);
    }
  }

  private void move(Path tmp) throws IOException {
    try {
      Files.move(
          tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, replacing in place", path);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static List<Relationship> sorted(Collection<Relationship> edges) {
    List<Relationship> out = new ArrayList<>(edges);
    out.sort(Relationship.ORDER);
    return out;
  }
}
