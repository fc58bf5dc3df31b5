package socs.routing;

import com.typesafe.config.ConfigException;
import socs.routing.sim.Simulator;
import socs.routing.util.Configuration;

import java.io.BufferedReader;
import java.io.InputStreamReader;

public class Main {

  public static void main(String[] args) {
    if (args.length < 1 || args.length > 2) {
      System.out.println("Usage: java -jar routing-sim.jar [topology.conf] [DV|LS]");
      System.exit(1);
    }

    Configuration config;
    Simulator sim;
    try {
      config = new Configuration(args[0]);
      if (args.length == 2) {
        config = config.withEntry("socs.routing.algorithm", args[1]);
      }
      sim = new Simulator(config);
    } catch (ConfigException | IllegalArgumentException e) {
      System.err.println("Failed to load topology: " + e.getMessage());
      System.exit(2);
      return;
    }

    int status = 0;
    try {
      if (config.getBoolean("socs.routing.sim.interactive")) {
        sim.terminal(new BufferedReader(new InputStreamReader(System.in)), System.out);
      } else if (!sim.runBatch(System.out)) {
        status = 1;
      }
    } finally {
      sim.shutdown();
    }
    System.exit(status);
  }
}
