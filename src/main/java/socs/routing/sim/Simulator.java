package socs.routing.sim;

import socs.routing.message.LSA;
import socs.routing.node.DVRouter;
import socs.routing.node.LSRouter;
import socs.routing.node.Link;
import socs.routing.node.Router;
import socs.routing.node.RoutingAlgorithm;
import socs.routing.util.Clock;
import socs.routing.util.Configuration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Drives one simulation: builds a router per topology node, attaches neighbours on both ends of
 * every link, initializes the routing algorithm and then advances the shared clock one tick at a
 * time.
 */
public class Simulator {

  private final Configuration config;
  private final RoutingAlgorithm algorithm;
  private final Topology topology;
  private final Clock clock = new Clock();
  private final LinkedHashMap<String, Router> routers = new LinkedHashMap<String, Router>();
  private final List<Router> tickOrder;
  private final TickScheduler scheduler;
  private final RouteVerifier verifier;
  private boolean initialized = false;

  public Simulator(Configuration config) {
    this(config, Topology.fromConfiguration(config),
        RoutingAlgorithm.parse(config.getString("socs.routing.algorithm")));
  }

  public Simulator(Configuration config, Topology topology, RoutingAlgorithm algorithm) {
    this.config = config;
    this.topology = topology;
    this.algorithm = algorithm;

    PrintStream log = config.getBoolean("socs.routing.sim.verbose") ? System.out : null;
    for (String id : topology.getRouters()) {
      Router router = algorithm.newRouter(id, clock, config);
      router.setLog(log);
      routers.put(id, router);
    }
    for (Link link : topology.getLinks()) {
      Router r1 = routers.get(link.getRouter1());
      Router r2 = routers.get(link.getRouter2());
      r1.attach(r2, link.getWeight());
      r2.attach(r1, link.getWeight());
    }
    tickOrder = new ArrayList<Router>(routers.values());

    int threads = config.getBoolean("socs.routing.sim.parallel") ? config.getInt("socs.routing.sim.threads") : 1;
    Random shuffle = config.getBoolean("socs.routing.sim.shuffle")
        ? new Random(config.getLong("socs.routing.sim.seed")) : null;
    scheduler = new TickScheduler(threads, shuffle);
    verifier = new RouteVerifier(topology);
  }

  /** Initializes every router once; ticking does this implicitly. */
  public void initialize() {
    if (initialized) {
      return;
    }
    for (Router router : tickOrder) {
      router.initializeAlgorithm();
    }
    scheduler.start();
    initialized = true;
  }

  public void tick() {
    initialize();
    scheduler.runTick(tickOrder);
    clock.advance();
  }

  public void run(int ticks) {
    for (int i = 0; i < ticks; i++) {
      tick();
    }
  }

  /** Runs the number of ticks configured as {@code socs.routing.ticks}. */
  public void run() {
    run(config.getInt("socs.routing.ticks"));
  }

  public void shutdown() {
    scheduler.stop();
  }

  public RouteVerifier.Report verify() {
    return verifier.verify(routers);
  }

  public RouteVerifier.Trace trace(String source, String destination) {
    return verifier.trace(routers, source, destination);
  }

  /** @return the router, or null if there is no router with that id */
  public Router getRouter(String id) {
    return routers.get(id);
  }

  public Map<String, Router> getRouters() {
    return Collections.unmodifiableMap(routers);
  }

  public RoutingAlgorithm getAlgorithm() {
    return algorithm;
  }

  public Topology getTopology() {
    return topology;
  }

  public Clock getClock() {
    return clock;
  }

  /**
   * run the configured number of ticks, print every forwarding table and check them.
   *
   * @return true if every forwarding table is correct
   */
  public boolean runBatch(PrintStream out) {
    out.println(algorithm + " simulation of " + routers.size() + " routers, "
        + topology.getLinks().size() + " links");
    run();
    out.println("after " + clock.readTick() + " ticks:");
    for (Router router : tickOrder) {
      printTable(router, out);
    }
    RouteVerifier.Report report = verify();
    out.println(report);
    return report.isCorrect();
  }

  private void printTable(Router router, PrintStream out) {
    out.println(router.getRouterId() + ":");
    Map<String, Integer> dv = router instanceof DVRouter ? ((DVRouter) router).getDistanceVector() : null;
    for (Map.Entry<String, String> e : router.getForwardingTable().entrySet()) {
      out.print("\t" + e.getKey() + " via " + e.getValue());
      if (dv != null && dv.containsKey(e.getKey())) {
        out.print(" (" + dv.get(e.getKey()) + ")");
      }
      out.println();
    }
  }

  public void terminal(BufferedReader bReader, PrintStream out) {
    try {
      out.println("========================================");
      out.println("Algorithm : " + algorithm);
      out.println("Routers : " + routers.size());
      out.println("Links : " + topology.getLinks().size());
      out.println("========================================");

      while (true) {
        String command = bReader.readLine();
        if (command == null) break;
        command = command.trim();
        if (command.isEmpty()) {
          continue;
        }

        String[] cmdLine = command.split("\\s+");
        if (command.equals("quit")) {
          break;
        } else if (cmdLine[0].equals("tick")) {
          if (cmdLine.length > 2) {
            out.println("Usage: tick [count]");
            continue;
          }
          Integer count = cmdLine.length == 2 ? parseCount(cmdLine[1], out) : Integer.valueOf(1);
          if (count == null) {
            continue;
          }
          run(count);
          out.println("tick " + clock.readTick());
        } else if (command.equals("run")) {
          run();
          out.println("tick " + clock.readTick());
        } else if (cmdLine[0].equals("table")) {
          if (cmdLine.length != 2) {
            out.println("Usage: table [router]");
            continue;
          }
          Router router = lookup(cmdLine[1], out);
          if (router != null) {
            printTable(router, out);
          }
        } else if (cmdLine[0].equals("neighbors")) {
          if (cmdLine.length != 2) {
            out.println("Usage: neighbors [router]");
            continue;
          }
          Router router = lookup(cmdLine[1], out);
          if (router != null) {
            for (Map.Entry<String, Integer> link : router.getLinks().entrySet()) {
              out.println(link.getKey() + " " + link.getValue());
            }
          }
        } else if (cmdLine[0].equals("detect")) {
          if (cmdLine.length != 3) {
            out.println("Usage: detect [source] [destination]");
            continue;
          }
          if (lookup(cmdLine[1], out) == null || lookup(cmdLine[2], out) == null) {
            continue;
          }
          RouteVerifier.Trace trace = trace(cmdLine[1], cmdLine[2]);
          if (trace.isComplete()) {
            out.println(trace + " (" + trace.getCost() + ")");
          } else {
            out.println("No path found: " + trace.getFailure());
          }
        } else if (cmdLine[0].equals("lsd")) {
          if (cmdLine.length != 2) {
            out.println("Usage: lsd [router]");
            continue;
          }
          Router router = lookup(cmdLine[1], out);
          if (router instanceof LSRouter) {
            for (LSA lsa : ((LSRouter) router).getLsaTable().values()) {
              out.println(lsa);
            }
          } else if (router != null) {
            out.println(router.getRouterId() + " is not a link state router");
          }
        } else if (command.equals("verify")) {
          out.println(verify());
        } else {
          out.println("Unknown command: " + command);
          out.println("Try: tick, run, table, neighbors, detect, lsd, verify, quit");
        }
      }
    } catch (IOException e) {
      System.err.println("Failed to read command: " + e.getMessage());
    }
  }

  private Router lookup(String id, PrintStream out) {
    Router router = routers.get(id);
    if (router == null) {
      out.println("Unknown router: " + id);
    }
    return router;
  }

  private Integer parseCount(String value, PrintStream out) {
    try {
      int count = Integer.parseInt(value);
      if (count < 0) {
        out.println("Invalid count (expected a non-negative integer): " + value);
        return null;
      }
      return count;
    } catch (NumberFormatException e) {
      out.println("Invalid count (expected a non-negative integer): " + value);
      return null;
    }
  }
}
