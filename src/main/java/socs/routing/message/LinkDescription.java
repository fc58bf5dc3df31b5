package socs.routing.message;

import java.io.Serializable;

public class LinkDescription implements Serializable {
  public final String linkID;
  public final int weight; //link cost towards linkID

  public LinkDescription(String linkID, int weight) {
    this.linkID = linkID;
    this.weight = weight;
  }

  public String toString() {
    return linkID + "," + weight;
  }
}
