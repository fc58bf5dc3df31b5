package socs.routing.util;

/**
 * The logical clock shared by every router of one simulation.
 * Only the simulator advances it.
 */
public class Clock {

  private volatile int tick = 0;

  public int readTick() {
    return tick;
  }

  public void advance() {
    tick++;
  }
}
