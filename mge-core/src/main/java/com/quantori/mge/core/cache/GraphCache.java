package com.quantori.mge.core.cache;

import com.quantori.mge.api.model.Molecule;
import com.quantori.mge.api.model.RingSet;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Derived data per molecule, keyed by molecule identity and dropped once the molecule is garbage
 * collected. An entry is valid only for the structural version it was computed at.
 */
@Slf4j
public class GraphCache {

  private final Map<Molecule, Entry> entries = Collections.synchronizedMap(new WeakHashMap<>());

  public boolean isEnriched(Molecule molecule) {
    return current(molecule).map(entry -> entry.enriched).orElse(false);
  }

  public void markEnriched(Molecule molecule) {
    entryFor(molecule).enriched = true;
  }

  public Optional<RingSet> getRingSet(Molecule molecule) {
    return current(molecule).map(entry -> entry.ringSet);
  }

  public void putRingSet(Molecule molecule, RingSet ringSet) {
    entryFor(molecule).ringSet = ringSet;
  }

  public boolean isAromaticityPerceived(Molecule molecule) {
    return current(molecule).map(entry -> entry.aromaticityPerceived).orElse(false);
  }

  public void markAromaticityPerceived(Molecule molecule) {
    entryFor(molecule).aromaticityPerceived = true;
  }

  public int size() {
    return entries.size();
  }

  private Optional<Entry> current(Molecule molecule) {
    Entry entry = entries.get(molecule);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.version != molecule.getVersion()) {
      log.debug("Dropping derived data of {} computed at version {}, now {}",
          molecule, entry.version, molecule.getVersion());
      entries.remove(molecule);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  private Entry entryFor(Molecule molecule) {
    return current(molecule).orElseGet(() -> {
      Entry entry = new Entry(molecule.getVersion());
      entries.put(molecule, entry);
      return entry;
    });
  }

  private static final class Entry {
    private final long version;
    private boolean enriched;
    private RingSet ringSet;
    private boolean aromaticityPerceived;

    private Entry(long version) {
      this.version = version;
    }
  }
}
