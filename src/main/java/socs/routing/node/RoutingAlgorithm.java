package socs.routing.node;

import socs.routing.util.Clock;
import socs.routing.util.Configuration;

import java.util.Locale;

public enum RoutingAlgorithm {

  DV {
    @Override
    public Router newRouter(String routerId, Clock clock, Configuration config) {
      return new DVRouter(routerId, clock);
    }
  },

  LS {
    @Override
    public Router newRouter(String routerId, Clock clock, Configuration config) {
      return new LSRouter(routerId, clock, config.getInt("socs.routing.ls.broadcastInterval"));
    }
  };

  public abstract Router newRouter(String routerId, Clock clock, Configuration config);

  public static RoutingAlgorithm parse(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown routing algorithm " + name + " (expected DV or LS)", e);
    }
  }
}
