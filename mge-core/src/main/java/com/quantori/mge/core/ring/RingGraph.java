package com.quantori.mge.core.ring;

import com.quantori.mge.api.model.Atom;
import com.quantori.mge.api.model.Bond;
import com.quantori.mge.api.model.Molecule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense view of the ring subgraph: ring atoms numbered by ascending atom id, ring bonds numbered
 * in molecule order.
 */
class RingGraph {

  private final int[] atomIds;
  private final List<Bond> edges = new ArrayList<>();
  private final int[][] ends;
  private final List<List<Integer>> incidence = new ArrayList<>();
  private final Map<Long, Integer> edgeByPair = new HashMap<>();

  RingGraph(Molecule molecule) {
    atomIds = molecule.getAtoms().stream()
        .filter(Atom::isInRing)
        .mapToInt(Atom::getId)
        .sorted()
        .toArray();
    Map<Integer, Integer> vertexById = new HashMap<>();
    for (int i = 0; i < atomIds.length; i++) {
      vertexById.put(atomIds[i], i);
      incidence.add(new ArrayList<>());
    }
    for (Bond bond : molecule.getBonds()) {
      if (bond.isInRing()) {
        edges.add(bond);
      }
    }
    ends = new int[edges.size()][];
    for (int e = 0; e < edges.size(); e++) {
      Bond bond = edges.get(e);
      int a = vertexById.get(bond.getAtom1());
      int b = vertexById.get(bond.getAtom2());
      ends[e] = new int[] {a, b};
      incidence.get(a).add(e);
      incidence.get(b).add(e);
      edgeByPair.put(key(a, b), e);
    }
  }

  int size() {
    return atomIds.length;
  }

  int edgeCount() {
    return edges.size();
  }

  int atomId(int vertex) {
    return atomIds[vertex];
  }

  Bond bond(int edge) {
    return edges.get(edge);
  }

  List<Integer> edgesOf(int vertex) {
    return incidence.get(vertex);
  }

  int first(int edge) {
    return ends[edge][0];
  }

  int second(int edge) {
    return ends[edge][1];
  }

  int other(int edge, int vertex) {
    return ends[edge][0] == vertex ? ends[edge][1] : ends[edge][0];
  }

  int edgeBetween(int a, int b) {
    return edgeByPair.get(key(a, b));
  }

  private static long key(int a, int b) {
    return ((long) Math.min(a, b) << 32) | Math.max(a, b);
  }
}
