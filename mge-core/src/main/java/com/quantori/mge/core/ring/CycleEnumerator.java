package com.quantori.mge.core.ring;

import com.quantori.mge.api.model.Bond;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enumerates candidate cycles of the ring subgraph, i.e. the atoms and bonds flagged as being in
 * a ring.
 */
class CycleEnumerator {

  private final RingGraph graph;

  CycleEnumerator(RingGraph graph) {
    this.graph = graph;
  }

  /**
   * Every elementary cycle up to {@code maxLength} atoms, each reported once, by depth-first
   * search from its lowest atom.
   *
   * @param maxLength longest cycle
   * @param maxCycles candidate cap
   * @return the cycles, empty when the cap was exceeded
   */
  Optional<List<Cycle>> depthFirst(int maxLength, int maxCycles) {
    List<Cycle> cycles = new ArrayList<>();
    for (int start = 0; start < graph.size(); start++) {
      int[] path = new int[maxLength];
      int[] pathBonds = new int[maxLength];
      boolean[] onPath = new boolean[graph.size()];
      path[0] = start;
      onPath[start] = true;
      if (!extend(start, path, pathBonds, 1, onPath, maxLength, maxCycles, cycles)) {
        return Optional.empty();
      }
    }
    return Optional.of(cycles);
  }

  private boolean extend(int start, int[] path, int[] pathBonds, int length, boolean[] onPath,
                         int maxLength, int maxCycles, List<Cycle> cycles) {
    int current = path[length - 1];
    for (int edge : graph.edgesOf(current)) {
      int next = graph.other(edge, current);
      if (next == start) {
        if (length >= 3 && path[1] < current) {
          pathBonds[length - 1] = edge;
          cycles.add(toCycle(path, pathBonds, length));
          if (cycles.size() > maxCycles) {
            return false;
          }
        }
        continue;
      }
      if (next < start || onPath[next] || length >= maxLength) {
        continue;
      }
      path[length] = next;
      pathBonds[length - 1] = edge;
      onPath[next] = true;
      boolean within = extend(start, path, pathBonds, length + 1, onPath, maxLength, maxCycles,
          cycles);
      onPath[next] = false;
      if (!within) {
        return false;
      }
    }
    return true;
  }

  /**
   * Horton candidates: for every vertex and edge, the cycle made of the edge and the two shortest
   * paths joining its ends to the vertex, when those paths meet only at the vertex.
   *
   * @param maxLength longest cycle
   * @return distinct candidate cycles
   */
  List<Cycle> breadthFirst(int maxLength) {
    List<Cycle> cycles = new ArrayList<>();
    Set<BitSet> seen = new HashSet<>();
    for (int root = 0; root < graph.size(); root++) {
      int[] parent = new int[graph.size()];
      int[] parentEdge = new int[graph.size()];
      int[] distance = new int[graph.size()];
      Arrays.fill(distance, -1);
      Deque<Integer> queue = new ArrayDeque<>();
      distance[root] = 0;
      parent[root] = -1;
      queue.add(root);
      while (!queue.isEmpty()) {
        int current = queue.poll();
        for (int edge : graph.edgesOf(current)) {
          int next = graph.other(edge, current);
          if (distance[next] < 0) {
            distance[next] = distance[current] + 1;
            parent[next] = current;
            parentEdge[next] = edge;
            queue.add(next);
          }
        }
      }

      for (int edge = 0; edge < graph.edgeCount(); edge++) {
        int x = graph.first(edge);
        int y = graph.second(edge);
        if (distance[x] < 0 || distance[y] < 0 || parentEdge[x] == edge && parent[x] == y
            || parentEdge[y] == edge && parent[y] == x) {
          continue;
        }
        int length = distance[x] + distance[y] + 1;
        if (length < 3 || length > maxLength) {
          continue;
        }
        List<Integer> toX = pathToRoot(x, parent);
        List<Integer> toY = pathToRoot(y, parent);
        Set<Integer> shared = new HashSet<>(toX);
        shared.retainAll(toY);
        if (shared.size() != 1) {
          continue;
        }
        int[] atoms = new int[length];
        int[] bonds = new int[length];
        int i = 0;
        for (int k = toX.size() - 1; k >= 0; k--) {
          atoms[i++] = toX.get(k);
        }
        for (int k = 0; k < toY.size() - 1; k++) {
          atoms[i++] = toY.get(k);
        }
        for (int k = 0; k < length; k++) {
          bonds[k] = graph.edgeBetween(atoms[k], atoms[(k + 1) % length]);
        }
        Cycle cycle = toCycle(atoms, bonds, length);
        if (seen.add(cycle.edges())) {
          cycles.add(cycle);
        }
      }
    }
    return cycles;
  }

  private List<Integer> pathToRoot(int vertex, int[] parent) {
    List<Integer> path = new ArrayList<>();
    for (int v = vertex; v >= 0; v = parent[v]) {
      path.add(v);
    }
    return path;
  }

  private Cycle toCycle(int[] path, int[] pathBonds, int length) {
    int[] atoms = new int[length];
    int[] bonds = new int[length];
    BitSet edges = new BitSet(graph.edgeCount());
    for (int i = 0; i < length; i++) {
      atoms[i] = graph.atomId(path[i]);
      Bond bond = graph.bond(pathBonds[i]);
      bonds[i] = bond.getId();
      edges.set(pathBonds[i]);
    }
    return Cycle.of(atoms, bonds, edges);
  }
}
