package socs.routing.message;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A link state advertisement: the link costs of one originating router.
 * <p/>
 * LSAs are shared between routers by reference while flooding, so they are immutable.
 */
public class LSA implements Serializable {

  //id of the originating router
  public final String linkStateID;

  public final List<LinkDescription> links;

  private LSA(String linkStateID, List<LinkDescription> links) {
    this.linkStateID = linkStateID;
    this.links = Collections.unmodifiableList(links);
  }

  public static LSA of(String originator, Map<String, Integer> costs) {
    LinkedList<LinkDescription> links = new LinkedList<LinkDescription>();
    // sorted so that two LSAs built from the same costs compare equal
    for (Map.Entry<String, Integer> e : new TreeMap<String, Integer>(costs).entrySet()) {
      links.add(new LinkDescription(e.getKey(), e.getValue()));
    }
    return new LSA(originator, links);
  }

  public Map<String, Integer> costs() {
    Map<String, Integer> costs = new TreeMap<String, Integer>();
    for (LinkDescription ld : links) {
      costs.put(ld.linkID, ld.weight);
    }
    return costs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LSA)) {
      return false;
    }
    LSA other = (LSA) o;
    return linkStateID.equals(other.linkStateID) && costs().equals(other.costs());
  }

  @Override
  public int hashCode() {
    return 31 * linkStateID.hashCode() + costs().hashCode();
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(linkStateID).append(":\t");
    for (LinkDescription ld : links) {
      sb.append(ld.linkID).append(",").append(ld.weight).append("\t");
    }
    return sb.toString();
  }
}
