package socs.routing.node;

import socs.routing.util.Clock;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State every simulated router carries regardless of the routing algorithm: its id, the cost of
 * each attached link, handles to its neighbours, the shared clock and the forwarding table the
 * algorithm fills in.
 * <p/>
 * Each router guards its own state with its own monitor. A router never calls into a neighbour
 * while holding that monitor, so neighbours may tick concurrently.
 */
public abstract class Router {

  //link costs are short weights; path sums stay far below Integer.MAX_VALUE
  public static final int MAX_LINK_COST = Short.MAX_VALUE;

  protected final String routerId;
  protected final Clock clock;

  //neighbor id => link cost, fixed once the simulation starts
  protected final HashMap<String, Integer> links = new HashMap<String, Integer>();
  protected final List<Router> neighbors = new ArrayList<Router>();

  //destination => next hop
  protected final HashMap<String, String> fwdTable = new HashMap<String, String>();

  private PrintStream log;

  protected Router(String routerId, Clock clock) {
    this.routerId = routerId;
    this.clock = clock;
  }

  /**
   * attach a neighbour over a link of the given cost. Only one side is attached; the simulator
   * calls this on both endpoints.
   */
  public void attach(Router neighbor, int weight) {
    if (neighbor == this || neighbor.routerId.equals(routerId)) {
      throw new IllegalArgumentException("router " + routerId + " cannot link to itself");
    }
    if (neighbor.getAlgorithm() != getAlgorithm()) {
      throw new IllegalArgumentException("cannot attach " + neighbor.getAlgorithm() + " router "
          + neighbor.routerId + " to " + getAlgorithm() + " router " + routerId);
    }
    if (weight < 0 || weight > MAX_LINK_COST) {
      throw new IllegalArgumentException("cost " + weight + " on link " + routerId + " <-> "
          + neighbor.routerId + " is outside 0.." + MAX_LINK_COST);
    }
    if (links.containsKey(neighbor.routerId)) {
      throw new IllegalArgumentException("duplicate link " + routerId + " <-> " + neighbor.routerId);
    }
    links.put(neighbor.routerId, weight);
    neighbors.add(neighbor);
  }

  /** Routers only exchange advertisements with neighbours running the same algorithm. */
  public abstract RoutingAlgorithm getAlgorithm();

  /** Called once before the first tick. */
  public abstract void initializeAlgorithm();

  /** Called once per tick by the simulator. */
  public abstract void runOneTick();

  public String getRouterId() {
    return routerId;
  }

  public Map<String, Integer> getLinks() {
    return Collections.unmodifiableMap(links);
  }

  public List<Router> getNeighbors() {
    return Collections.unmodifiableList(neighbors);
  }

  public synchronized Map<String, String> getForwardingTable() {
    return new TreeMap<String, String>(fwdTable);
  }

  /** Route changes are printed to {@code out}; {@code null} keeps the router silent. */
  public void setLog(PrintStream out) {
    log = out;
  }

  protected void log(String message) {
    PrintStream out = log;
    if (out != null) {
      out.println("[" + clock.readTick() + "] " + routerId + ": " + message);
    }
  }

  public String toString() {
    return routerId;
  }
}
