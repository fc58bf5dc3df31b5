package socs.routing.node;

import org.junit.Before;
import org.junit.Test;
import socs.routing.util.Clock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class DVRouterTest {

  private Clock clock;
  private DVRouter self;
  private DVRouter a;
  private DVRouter b;
  private List<DVRouter> all;

  @Before
  public void setUp() {
    clock = new Clock();
    self = new DVRouter("self", clock);
    a = new DVRouter("A", clock);
    b = new DVRouter("B", clock);
    link(self, a, 1);
    link(a, b, 1);
    link(self, b, 5);
    all = Arrays.asList(self, a, b);
  }

  static void link(Router r1, Router r2, int weight) {
    r1.attach(r2, weight);
    r2.attach(r1, weight);
  }

  private static Map<String, Integer> costs(Object... pairs) {
    Map<String, Integer> costs = new HashMap<String, Integer>();
    for (int i = 0; i < pairs.length; i += 2) {
      costs.put((String) pairs[i], (Integer) pairs[i + 1]);
    }
    return costs;
  }

  private void initializeAll(List<DVRouter> routers) {
    for (DVRouter router : routers) {
      router.initializeAlgorithm();
    }
  }

  private void tick(List<DVRouter> routers, int ticks) {
    for (int i = 0; i < ticks; i++) {
      for (DVRouter router : routers) {
        router.runOneTick();
      }
      clock.advance();
    }
  }

  @Test
  public void initializeSeedsNeighboursAndSelf() {
    self.initializeAlgorithm();

    assertEquals(costs("self", 0, "A", 1, "B", 5), self.getDistanceVector());
    assertEquals("self", self.getForwardingTable().get("self"));
    assertEquals("A", self.getForwardingTable().get("A"));
    assertEquals("B", self.getForwardingTable().get("B"));
    assertTrue(self.hasPendingChange());
  }

  @Test
  public void triangleRoutesThroughCheaperNeighbour() {
    initializeAll(all);
    tick(all, 5);

    assertEquals(costs("self", 0, "A", 1, "B", 2), self.getDistanceVector());
    assertEquals("A", self.getForwardingTable().get("B"));
    assertEquals("A", self.getForwardingTable().get("A"));
    assertEquals(costs("self", 2, "A", 1, "B", 0), b.getDistanceVector());
    assertEquals("A", b.getForwardingTable().get("self"));
  }

  @Test
  public void distancesNeverIncrease() {
    List<DVRouter> routers = fiveRouters();
    initializeAll(routers);
    List<Map<String, Integer>> previous = new ArrayList<Map<String, Integer>>();
    for (DVRouter router : routers) {
      previous.add(router.getDistanceVector());
    }
    for (int t = 0; t < 10; t++) {
      tick(routers, 1);
      for (int i = 0; i < routers.size(); i++) {
        Map<String, Integer> now = routers.get(i).getDistanceVector();
        for (Map.Entry<String, Integer> before : previous.get(i).entrySet()) {
          assertTrue(now.containsKey(before.getKey()));
          assertTrue(now.get(before.getKey()) <= before.getValue());
        }
        previous.set(i, now);
      }
    }
  }

  @Test
  public void quiescesOnceConverged() {
    initializeAll(all);
    tick(all, 10);

    long[] sent = new long[all.size()];
    for (int i = 0; i < all.size(); i++) {
      assertFalse(all.get(i).hasPendingChange());
      sent[i] = all.get(i).getAdvertisementsSent();
      assertTrue(sent[i] > 0);
    }

    tick(all, 10);
    for (int i = 0; i < all.size(); i++) {
      assertFalse(all.get(i).hasPendingChange());
      assertEquals(sent[i], all.get(i).getAdvertisementsSent());
    }
  }

  @Test
  public void noOpAdvertisementDoesNotMaskEarlierChange() {
    initializeAll(all);
    self.runOneTick();
    assertFalse(self.hasPendingChange());

    boolean first = self.processAdvertisement(costs("A", 0, "B", 1), "A");
    boolean second = self.processAdvertisement(costs("self", 5, "B", 5), "B");

    assertTrue(first);
    assertFalse(second);
    assertTrue(self.hasPendingChange());
    assertEquals(Integer.valueOf(2), self.getDistanceVector().get("B"));
  }

  @Test
  public void tickClearsChangeFlagEvenWithoutNeighbours() {
    DVRouter alone = new DVRouter("alone", clock);
    alone.initializeAlgorithm();
    assertTrue(alone.hasPendingChange());

    alone.runOneTick();

    assertFalse(alone.hasPendingChange());
    assertEquals(0, alone.getAdvertisementsSent());
  }

  @Test
  public void unmentionedDestinationsAreLeftAlone() {
    self.initializeAlgorithm();

    assertFalse(self.processAdvertisement(costs("A", 0), "A"));

    assertEquals(Integer.valueOf(5), self.getDistanceVector().get("B"));
    assertEquals("B", self.getForwardingTable().get("B"));
  }

  @Test
  public void unknownDestinationIsLearnedThroughAdvertiser() {
    self.initializeAlgorithm();

    assertTrue(self.processAdvertisement(costs("A", 0, "Q", 3), "A"));

    assertEquals(Integer.valueOf(4), self.getDistanceVector().get("Q"));
    assertEquals("A", self.getForwardingTable().get("Q"));
  }

  @Test
  public void selfIsNeverDowngraded() {
    DVRouter zero = new DVRouter("zero", clock);
    DVRouter peer = new DVRouter("peer", clock);
    link(zero, peer, 0);
    zero.initializeAlgorithm();

    assertFalse(zero.processAdvertisement(costs("zero", 0, "peer", 0), "peer"));

    assertEquals(Integer.valueOf(0), zero.getDistanceVector().get("zero"));
    assertEquals("zero", zero.getForwardingTable().get("zero"));
  }

  @Test
  public void advertisementFromNonNeighbourIsIgnored() {
    self.initializeAlgorithm();

    assertFalse(self.processAdvertisement(costs("X", 0, "Q", 1), "X"));

    assertNull(self.getDistanceVector().get("Q"));
    assertNull(self.getForwardingTable().get("X"));
  }

  @Test
  public void neighboursReceiveASnapshotOfTheVector() {
    final List<Map<String, Integer>> received = new ArrayList<Map<String, Integer>>();
    DVRouter recorder = new DVRouter("rec", clock) {
      @Override
      public synchronized boolean processAdvertisement(Map<String, Integer> dvAdv, String advRouter) {
        received.add(dvAdv);
        return false;
      }
    };
    DVRouter sender = new DVRouter("snd", clock);
    link(sender, recorder, 3);
    sender.initializeAlgorithm();
    sender.runOneTick();

    sender.processAdvertisement(costs("rec", 0, "far", 7), "rec");

    assertEquals(1, received.size());
    assertEquals(costs("snd", 0, "rec", 3), received.get(0));
    assertThrows(UnsupportedOperationException.class, () -> received.get(0).put("x", 1));
  }

  @Test
  public void convergedCostsDoNotDependOnTickOrder() {
    List<DVRouter> forward = fiveRouters();
    initializeAll(forward);
    tick(forward, 10);

    clock = new Clock();
    List<DVRouter> backward = new ArrayList<DVRouter>(fiveRouters());
    Collections.reverse(backward);
    initializeAll(backward);
    tick(backward, 10);

    Map<String, Map<String, Integer>> expected = new HashMap<String, Map<String, Integer>>();
    for (DVRouter router : forward) {
      expected.put(router.getRouterId(), router.getDistanceVector());
    }
    for (DVRouter router : backward) {
      assertEquals(expected.get(router.getRouterId()), router.getDistanceVector());
    }
    assertEquals(costs("A", 0, "B", 3, "C", 1, "D", 8, "E", 11), forward.get(0).getDistanceVector());
  }

  @Test(expected = IllegalArgumentException.class)
  public void cannotAttachLinkStateNeighbour() {
    self.attach(new LSRouter("L", clock), 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsNegativeLinkCost() {
    self.attach(new DVRouter("N", clock), -1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsLinkCostAboveBound() {
    self.attach(new DVRouter("N", clock), Integer.MAX_VALUE);
  }

  @Test
  public void largestLinkCostKeepsSelfAtZero() {
    DVRouter near = new DVRouter("near", clock);
    DVRouter far = new DVRouter("far", clock);
    link(near, far, Router.MAX_LINK_COST);
    List<DVRouter> pair = Arrays.asList(near, far);
    initializeAll(pair);
    tick(pair, 2);

    assertEquals(costs("near", 0, "far", Router.MAX_LINK_COST), near.getDistanceVector());
    assertEquals("near", near.getForwardingTable().get("near"));
    assertEquals("far", near.getForwardingTable().get("far"));
  }

  // A-B 4, A-C 1, C-B 2, B-D 5, C-D 8, D-E 3, C-E 10
  private List<DVRouter> fiveRouters() {
    DVRouter ra = new DVRouter("A", clock);
    DVRouter rb = new DVRouter("B", clock);
    DVRouter rc = new DVRouter("C", clock);
    DVRouter rd = new DVRouter("D", clock);
    DVRouter re = new DVRouter("E", clock);
    link(ra, rb, 4);
    link(ra, rc, 1);
    link(rc, rb, 2);
    link(rb, rd, 5);
    link(rc, rd, 8);
    link(rd, re, 3);
    link(rc, re, 10);
    return Arrays.asList(ra, rb, rc, rd, re);
  }
}
