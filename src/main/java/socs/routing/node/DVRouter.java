package socs.routing.node;

import socs.routing.util.Clock;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Distance vector (Bellman-Ford) router.
 * <p/>
 * Keeps the best known cost to every destination it has heard of and re-advertises the whole
 * vector to its neighbours on the first tick after it changes.
 */
public class DVRouter extends Router {

  //destination => best known cost; a missing destination is at infinity
  private final HashMap<String, Integer> dv = new HashMap<String, Integer>();

  //has dv changed since it was last advertised?
  private boolean dvChange = true;

  private long advertisementsSent = 0;

  public DVRouter(String routerId, Clock clock) {
    super(routerId, clock);
  }

  @Override
  public RoutingAlgorithm getAlgorithm() {
    return RoutingAlgorithm.DV;
  }

  @Override
  public synchronized void initializeAlgorithm() {
    for (Map.Entry<String, Integer> link : links.entrySet()) {
      dv.put(link.getKey(), link.getValue());
      fwdTable.put(link.getKey(), link.getKey());
    }
    dv.put(routerId, 0);
    fwdTable.put(routerId, routerId);
    dvChange = true;
  }

  @Override
  public void runOneTick() {
    Map<String, Integer> dvAdv;
    synchronized (this) {
      boolean changed = dvChange;
      dvChange = false;
      if (!changed) {
        return;
      }
      // neighbours get a snapshot, never our live vector
      dvAdv = Collections.unmodifiableMap(new HashMap<String, Integer>(dv));
      advertisementsSent += neighbors.size();
    }
    for (Router neighbor : neighbors) {
      send((DVRouter) neighbor, dvAdv, routerId);
    }
  }

  void send(DVRouter neighbor, Map<String, Integer> dvAdv, String advRouter) {
    neighbor.processAdvertisement(dvAdv, advRouter);
  }

  /**
   * relax this router's vector against the vector advertised by a neighbour.
   * <p/>
   * Destinations the neighbour does not mention are left alone. The pending change flag is
   * only ever raised here; it is cleared when the vector is next advertised.
   *
   * @param dvAdv     the neighbour's full distance vector
   * @param advRouter the neighbour that advertised it
   * @return true if this advertisement improved at least one route
   */
  public synchronized boolean processAdvertisement(Map<String, Integer> dvAdv, String advRouter) {
    Integer linkCost = links.get(advRouter);
    if (linkCost == null) {
      // only direct neighbours advertise to us
      return false;
    }

    boolean changed = false;
    for (Map.Entry<String, Integer> entry : dv.entrySet()) {
      Integer advertised = dvAdv.get(entry.getKey());
      if (advertised == null) {
        continue;
      }
      int candidate = Math.addExact(linkCost, advertised);
      if (candidate < entry.getValue()) {
        entry.setValue(candidate);
        fwdTable.put(entry.getKey(), advRouter);
        changed = true;
        log("route to " + entry.getKey() + " via " + advRouter + " cost " + candidate);
      }
    }

    for (Map.Entry<String, Integer> entry : dvAdv.entrySet()) {
      if (!dv.containsKey(entry.getKey())) {
        int cost = Math.addExact(linkCost, entry.getValue());
        dv.put(entry.getKey(), cost);
        fwdTable.put(entry.getKey(), advRouter);
        changed = true;
        log("learned " + entry.getKey() + " via " + advRouter + " cost " + cost);
      }
    }

    dvChange = dvChange || changed;
    return changed;
  }

  public synchronized Map<String, Integer> getDistanceVector() {
    return new TreeMap<String, Integer>(dv);
  }

  /** @return true if the vector changed and has not been advertised yet */
  public synchronized boolean hasPendingChange() {
    return dvChange;
  }

  /** Number of vectors sent so far, one per neighbour per advertising tick. */
  public synchronized long getAdvertisementsSent() {
    return advertisementsSent;
  }
}
