package socs.routing.sim;

import socs.routing.node.Link;
import socs.routing.node.Router;
import socs.routing.util.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The static network a simulation runs on: a set of router ids and the undirected, non-negative
 * cost links between them.
 */
public class Topology {

  private final LinkedHashSet<String> routers = new LinkedHashSet<String>();
  private final List<Link> links = new ArrayList<Link>();

  /**
   * read {@code socs.routing.topology}: an optional list of router ids (for routers without
   * links) and a list of {@code {from, to, cost}} links. Routers named by a link are added
   * implicitly.
   */
  public static Topology fromConfiguration(Configuration config) {
    Topology topology = new Topology();
    for (String id : config.getStringList("socs.routing.topology.routers")) {
      topology.addRouter(id);
    }
    for (Configuration link : config.getConfigList("socs.routing.topology.links")) {
      topology.addLink(link.getString("from"), link.getString("to"), link.getInt("cost"));
    }
    return topology;
  }

  public Topology addRouter(String id) {
    if (id == null || id.trim().isEmpty()) {
      throw new IllegalArgumentException("router id must not be empty");
    }
    routers.add(id);
    return this;
  }

  public Topology addLink(String from, String to, int cost) {
    if (from.equals(to)) {
      throw new IllegalArgumentException("self link on router " + from);
    }
    if (cost < 0 || cost > Router.MAX_LINK_COST) {
      throw new IllegalArgumentException("cost " + cost + " on link " + from + " <-> " + to
          + " is outside 0.." + Router.MAX_LINK_COST);
    }
    for (Link link : links) {
      if (link.connects(from, to)) {
        throw new IllegalArgumentException("duplicate link " + from + " <-> " + to);
      }
    }
    addRouter(from);
    addRouter(to);
    links.add(new Link(from, to, cost));
    return this;
  }

  public Set<String> getRouters() {
    return Collections.unmodifiableSet(routers);
  }

  public List<Link> getLinks() {
    return Collections.unmodifiableList(links);
  }

  /** @return the cost of the direct link between a and b, or null if they are not adjacent */
  public Integer cost(String a, String b) {
    for (Link link : links) {
      if (link.connects(a, b)) {
        return link.getWeight();
      }
    }
    return null;
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Link link : links) {
      sb.append(link).append("\n");
    }
    return sb.toString();
  }
}
