package ca.gc.cra.scout.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for events, warnings and reports.
 * <p><strong>Why:</strong> Lets tests pin timestamps without touching the system clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; watchers read the clock
 * from their own threads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
