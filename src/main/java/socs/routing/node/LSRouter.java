package socs.routing.node;

import socs.routing.message.LSA;
import socs.routing.util.Clock;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Link state router.
 * <p/>
 * Until the clock reaches the broadcast interval the router floods every LSA it holds to its
 * neighbours, once per originator. On the first tick at or after the interval it assumes the
 * topology is fully known, runs Dijkstra once and fills in the forwarding table. Later ticks do
 * nothing.
 */
public class LSRouter extends Router {

  //long enough for floods to complete even on large topologies
  public static final int DEFAULT_BROADCAST_INTERVAL = 1000;

  private final int broadcastInterval;

  private boolean broadcastComplete = false;
  private boolean routesComputed = false;

  private final LinkStateDatabase lsd;

  //originator => has its LSA been flooded to my neighbours?
  private final HashMap<String, Boolean> broadcasted = new HashMap<String, Boolean>();

  private int dijkstraRuns = 0;

  public LSRouter(String routerId, Clock clock) {
    this(routerId, clock, DEFAULT_BROADCAST_INTERVAL);
  }

  public LSRouter(String routerId, Clock clock, int broadcastInterval) {
    super(routerId, clock);
    if (broadcastInterval < 0) {
      throw new IllegalArgumentException("negative broadcast interval " + broadcastInterval);
    }
    this.broadcastInterval = broadcastInterval;
    this.lsd = new LinkStateDatabase(routerId);
    broadcasted.put(routerId, false);
  }

  @Override
  public RoutingAlgorithm getAlgorithm() {
    return RoutingAlgorithm.LS;
  }

  @Override
  public synchronized void initializeAlgorithm() {
    lsd.install(routerId, LSA.of(routerId, links));
    fwdTable.put(routerId, routerId);
  }

  @Override
  public void runOneTick() {
    int now = clock.readTick();
    List<LSA> pending = new ArrayList<LSA>();
    synchronized (this) {
      if (now >= broadcastInterval) {
        if (!routesComputed) {
          broadcastComplete = true;
          computeRoutes();
          routesComputed = true;
        }
        return;
      }
      for (Map.Entry<String, LSA> entry : lsd.snapshot().entrySet()) {
        if (!Boolean.TRUE.equals(broadcasted.get(entry.getKey()))) {
          pending.add(entry.getValue());
          broadcasted.put(entry.getKey(), true);
        }
      }
    }
    for (LSA lsa : pending) {
      for (Router neighbor : neighbors) {
        send((LSRouter) neighbor, lsa, lsa.linkStateID);
      }
    }
  }

  /**
   * deliver an LSA to a neighbour. {@code originator} is the router that produced the LSA,
   * which is not necessarily this router.
   */
  void send(LSRouter neighbor, LSA lsa, String originator) {
    neighbor.receiveLsa(lsa, originator);
  }

  /** Stores the LSA under its originator. Receiving the same LSA again changes nothing. */
  public synchronized void receiveLsa(LSA lsa, String originator) {
    lsd.install(originator, lsa);
  }

  private void computeRoutes() {
    LinkStateDatabase.ShortestPathTree spt = lsd.computeShortestPaths();
    dijkstraRuns++;
    for (String destination : spt.reachable()) {
      if (destination.equals(routerId)) {
        continue;
      }
      fwdTable.put(destination, spt.nextHop(destination));
    }
    log("computed routes to " + (fwdTable.size() - 1) + " of " + (lsd.size() - 1)
        + " known routers");
  }

  /** Shortest paths over the LSAs collected so far, without touching the forwarding table. */
  public synchronized LinkStateDatabase.ShortestPathTree shortestPaths() {
    return lsd.computeShortestPaths();
  }

  public synchronized Map<String, LSA> getLsaTable() {
    return lsd.snapshot();
  }

  public synchronized boolean isBroadcasted(String originator) {
    return Boolean.TRUE.equals(broadcasted.get(originator));
  }

  public synchronized boolean isBroadcastComplete() {
    return broadcastComplete;
  }

  public synchronized boolean isRoutesComputed() {
    return routesComputed;
  }

  public synchronized int getDijkstraRuns() {
    return dijkstraRuns;
  }
}
