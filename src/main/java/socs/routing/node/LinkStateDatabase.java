package socs.routing.node;

import socs.routing.message.LSA;
import socs.routing.message.LinkDescription;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * The LSAs a link state router has collected, keyed by originating router.
 * Not thread safe; the owning {@link LSRouter} guards it.
 */
public class LinkStateDatabase {

  //originator => LSA
  HashMap<String, LSA> _store = new HashMap<String, LSA>();

  private final String routerId;

  LinkStateDatabase(String routerId) {
    this.routerId = routerId;
  }

  /** Stores {@code lsa} under {@code originator}, replacing whatever was there. */
  void install(String originator, LSA lsa) {
    _store.put(originator, lsa);
  }

  LSA get(String originator) {
    return _store.get(originator);
  }

  int size() {
    return _store.size();
  }

  Map<String, LSA> snapshot() {
    return new LinkedHashMap<String, LSA>(_store);
  }

  /**
   * Dijkstra's algorithm from this router over every LSA in the database, using link costs as
   * weights. Only routers that have an LSA in the database take part; links towards any other
   * router are ignored. Routers that cannot be reached get no entry in the result.
   */
  ShortestPathTree computeShortestPaths() {
    HashMap<String, Integer> distance = new HashMap<String, Integer>();
    HashMap<String, String> parent = new HashMap<String, String>();
    if (!_store.containsKey(routerId)) {
      return new ShortestPathTree(routerId, distance, parent);
    }

    PriorityQueue<State> pq = new PriorityQueue<State>((a, b) -> Integer.compare(a.distance, b.distance));
    HashSet<String> visited = new HashSet<String>();

    distance.put(routerId, 0);
    pq.offer(new State(routerId, 0));

    while (!pq.isEmpty()) {
      State top = pq.poll();
      // stale queue entries for an already settled router
      if (!visited.add(top.nodeID)) {
        continue;
      }

      for (LinkDescription l : _store.get(top.nodeID).links) {
        String nextNode = l.linkID;
        if (!_store.containsKey(nextNode) || visited.contains(nextNode)) {
          continue;
        }
        int nextDist = Math.addExact(top.distance, l.weight);
        Integer known = distance.get(nextNode);
        if (known == null || nextDist < known) {
          distance.put(nextNode, nextDist);
          parent.put(nextNode, top.nodeID);
          pq.offer(new State(nextNode, nextDist));
        }
      }
    }
    return new ShortestPathTree(routerId, distance, parent);
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (LSA lsa : _store.values()) {
      sb.append(lsa).append("\n");
    }
    return sb.toString();
  }

  private static class State {
    final String nodeID;
    final int distance;

    State(String nodeID, int distance) {
      this.nodeID = nodeID;
      this.distance = distance;
    }
  }

  /**
   * Distances and predecessors from one source router, as produced by
   * {@link #computeShortestPaths()}.
   */
  public static class ShortestPathTree {

    private final String source;
    //reachable router => distance from source
    private final Map<String, Integer> distance;
    //reachable router => previous router on the shortest path
    private final Map<String, String> parent;

    ShortestPathTree(String source, Map<String, Integer> distance, Map<String, String> parent) {
      this.source = source;
      this.distance = distance;
      this.parent = parent;
    }

    public boolean isReachable(String destination) {
      return distance.containsKey(destination);
    }

    /** @return the shortest distance, or null if the destination is unreachable */
    public Integer distanceTo(String destination) {
      return distance.get(destination);
    }

    public String parentOf(String destination) {
      return parent.get(destination);
    }

    public Set<String> reachable() {
      return Collections.unmodifiableSet(distance.keySet());
    }

    /**
     * walk the predecessor chain back from {@code destination} to the router adjacent to the
     * source.
     *
     * @throws IllegalArgumentException if the destination is the source or is unreachable
     * @throws IllegalStateException    if the predecessor chain does not lead back to the source
     */
    public String nextHop(String destination) {
      if (source.equals(destination)) {
        throw new IllegalArgumentException("no next hop from " + source + " to itself");
      }
      if (!parent.containsKey(destination)) {
        throw new IllegalArgumentException(destination + " is not reachable from " + source);
      }

      HashSet<String> seen = new HashSet<String>();
      String current = destination;
      while (true) {
        if (!seen.add(current)) {
          throw new IllegalStateException("predecessor cycle at " + current
              + " while resolving next hop to " + destination);
        }
        String prev = parent.get(current);
        if (prev == null) {
          throw new IllegalStateException("predecessor chain of " + destination
              + " stops at " + current + " before reaching " + source);
        }
        if (prev.equals(source)) {
          return current;
        }
        current = prev;
      }
    }
  }
}
