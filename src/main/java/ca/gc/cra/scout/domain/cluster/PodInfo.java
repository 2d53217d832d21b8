package ca.gc.cra.scout.domain.cluster;

import java.util.Objects;

/**
 * Minimal pod view used to pick exec targets.
 *
 * @param name pod name
 * @param phase pod phase reported by the API ({@code Running}, {@code Pending}, ...)
 * @param ready whether the pod's Ready condition is {@code True}
 */
public record PodInfo(String name, String phase, boolean ready) {
  public PodInfo {
    Objects.requireNonNull(name, "name");
    phase = phase == null ? "Unknown" : phase;
  }

  public boolean running() {
    return "Running".equals(phase);
  }
}
