package socs.routing.sim;

import socs.routing.node.Link;
import socs.routing.node.Router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Checks forwarding tables against shortest paths computed over the whole topology.
 * <p/>
 * A table is correct when, for every destination reachable from the router, following next hops
 * router by router reaches the destination without a loop at exactly the shortest path cost,
 * and when it has no entry for a destination that cannot be reached.
 */
public class RouteVerifier {

  //router => neighbour => cost
  private final HashMap<String, HashMap<String, Integer>> adjacency = new HashMap<String, HashMap<String, Integer>>();

  public RouteVerifier(Topology topology) {
    for (String id : topology.getRouters()) {
      adjacency.put(id, new HashMap<String, Integer>());
    }
    for (Link link : topology.getLinks()) {
      adjacency.get(link.getRouter1()).put(link.getRouter2(), link.getWeight());
      adjacency.get(link.getRouter2()).put(link.getRouter1(), link.getWeight());
    }
  }

  /**
   * shortest path cost from {@code source} to every router reachable from it, with full
   * knowledge of the topology.
   */
  public Map<String, Integer> distancesFrom(String source) {
    HashMap<String, Integer> distance = new HashMap<String, Integer>();
    if (!adjacency.containsKey(source)) {
      return distance;
    }
    PriorityQueue<State> pq = new PriorityQueue<State>((a, b) -> Integer.compare(a.distance, b.distance));
    HashSet<String> settled = new HashSet<String>();
    distance.put(source, 0);
    pq.offer(new State(source, 0));
    while (!pq.isEmpty()) {
      State top = pq.poll();
      if (!settled.add(top.nodeID)) {
        continue;
      }
      for (Map.Entry<String, Integer> edge : adjacency.get(top.nodeID).entrySet()) {
        int nextDist = Math.addExact(top.distance, edge.getValue());
        Integer known = distance.get(edge.getKey());
        if (known == null || nextDist < known) {
          distance.put(edge.getKey(), nextDist);
          pq.offer(new State(edge.getKey(), nextDist));
        }
      }
    }
    return distance;
  }

  /**
   * follow forwarding tables from {@code source} towards {@code destination}.
   *
   * @param routers every router of the simulation by id
   */
  public Trace trace(Map<String, Router> routers, String source, String destination) {
    LinkedList<String> path = new LinkedList<String>();
    HashSet<String> visited = new HashSet<String>();
    String current = source;
    int cost = 0;
    path.add(current);
    while (!current.equals(destination)) {
      if (!visited.add(current)) {
        return Trace.failed(path, "forwarding loop at " + current);
      }
      Router router = routers.get(current);
      if (router == null) {
        return Trace.failed(path, "unknown router " + current);
      }
      String next = router.getForwardingTable().get(destination);
      if (next == null) {
        return Trace.failed(path, current + " has no route to " + destination);
      }
      Integer hopCost = adjacency.get(current).get(next);
      if (hopCost == null) {
        return Trace.failed(path, current + " forwards to " + next + ", which is not a neighbour");
      }
      cost = Math.addExact(cost, hopCost);
      current = next;
      path.add(current);
    }
    return new Trace(path, cost, null);
  }

  /** Checks every router's forwarding table. */
  public Report verify(Map<String, Router> routers) {
    List<String> problems = new ArrayList<String>();
    int checked = 0;
    for (Router router : routers.values()) {
      String source = router.getRouterId();
      Map<String, Integer> expected = distancesFrom(source);
      Map<String, String> table = router.getForwardingTable();

      if (!source.equals(table.get(source))) {
        problems.add(source + ": forwarding entry for itself is " + table.get(source));
      }
      for (String destination : table.keySet()) {
        if (!expected.containsKey(destination)) {
          problems.add(source + ": has a route to unreachable " + destination);
        }
      }
      for (Map.Entry<String, Integer> e : expected.entrySet()) {
        String destination = e.getKey();
        if (destination.equals(source)) {
          continue;
        }
        checked++;
        Trace trace = trace(routers, source, destination);
        if (!trace.isComplete()) {
          problems.add(source + " -> " + destination + ": " + trace.getFailure());
        } else if (trace.getCost() != e.getValue()) {
          problems.add(source + " -> " + destination + ": path " + trace + " costs "
              + trace.getCost() + ", shortest is " + e.getValue());
        }
      }
    }
    return new Report(checked, problems);
  }

  private static class State {
    final String nodeID;
    final int distance;

    State(String nodeID, int distance) {
      this.nodeID = nodeID;
      this.distance = distance;
    }
  }

  /** A path taken by following forwarding tables. */
  public static class Trace {
    private final List<String> path;
    private final int cost;
    private final String failure;

    Trace(List<String> path, int cost, String failure) {
      this.path = Collections.unmodifiableList(path);
      this.cost = cost;
      this.failure = failure;
    }

    static Trace failed(List<String> path, String failure) {
      return new Trace(path, -1, failure);
    }

    public boolean isComplete() {
      return failure == null;
    }

    public List<String> getPath() {
      return path;
    }

    /** @return the summed link cost, or -1 if the destination was not reached */
    public int getCost() {
      return cost;
    }

    public String getFailure() {
      return failure;
    }

    /** format: source -> router -> ... -> destination */
    public String toString() {
      return String.join(" -> ", path);
    }
  }

  public static class Report {
    private final int routesChecked;
    private final List<String> problems;

    Report(int routesChecked, List<String> problems) {
      this.routesChecked = routesChecked;
      this.problems = Collections.unmodifiableList(problems);
    }

    public boolean isCorrect() {
      return problems.isEmpty();
    }

    public int getRoutesChecked() {
      return routesChecked;
    }

    public List<String> getProblems() {
      return problems;
    }

    public String toString() {
      if (isCorrect()) {
        return "all " + routesChecked + " routes correct";
      }
      StringBuilder sb = new StringBuilder();
      sb.append(problems.size()).append(" problem(s) in ").append(routesChecked).append(" routes:");
      for (String problem : problems) {
        sb.append("\n  ").append(problem);
      }
      return sb.toString();
    }
  }
}
