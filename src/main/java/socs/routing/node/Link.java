package socs.routing.node;

/**
 * An undirected link of the simulated topology. Both endpoints see the same weight.
 */
public class Link {

  final String router1;
  final String router2;
  final int weight;

  public Link(String r1, String r2, int weight) {
    router1 = r1;
    router2 = r2;
    this.weight = weight;
  }

  public String getRouter1() {
    return router1;
  }

  public String getRouter2() {
    return router2;
  }

  public int getWeight() {
    return weight;
  }

  public boolean connects(String a, String b) {
    return (router1.equals(a) && router2.equals(b)) || (router1.equals(b) && router2.equals(a));
  }

  public String toString() {
    return router1 + " <-> " + router2 + " (" + weight + ")";
  }
}
