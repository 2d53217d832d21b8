package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.port.ClockPort;
import ca.gc.cra.scout.domain.session.CollectionWarning;
import ca.gc.cra.scout.domain.session.WarningKind;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe accumulator for non-fatal session problems. Every warning is also logged.
 *
 * @since 0.1.0
 */
public final class WarningLog {
  private static final Logger log = LoggerFactory.getLogger(WarningLog.class);

  private final ClockPort clock;
  private final List<CollectionWarning> warnings = new CopyOnWriteArrayList<>();

  public WarningLog(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public WarningLog() {
    this(ClockPort.SYSTEM);
  }

  public CollectionWarning record(WarningKind kind, String source, String message) {
    CollectionWarning warning = new CollectionWarning(kind, source, message, clock.now());
    warnings.add(warning);
    log.warn("{} [{}] {}", kind.name().toLowerCase(Locale.ROOT), source, message);
    return warning;
  }

  public List<CollectionWarning> snapshot() {
    return List.copyOf(warnings);
  }

  public long count(WarningKind kind) {
    return warnings.stream().filter(w -> w.kind() == kind).count();
  }
}
