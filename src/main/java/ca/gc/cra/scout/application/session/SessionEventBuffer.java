package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.port.ErrorEventSink;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory report buffer fed by the aggregator consumer.
 *
 * <p>Sources registered up front keep their position in {@link #countsBySource()} and report zero
 * when they never produced an event.</p>
 *
 * @since 0.1.0
 */
public final class SessionEventBuffer implements ErrorEventSink {
  private final List<ErrorEvent> events = new ArrayList<>();
  private final Map<String, Long> counts = new LinkedHashMap<>();

  public SessionEventBuffer(List<String> sources) {
    for (String source : Objects.requireNonNull(sources, "sources")) {
      counts.put(source, 0L);
    }
  }

  @Override
  public synchronized void accept(ErrorEvent event) {
    events.add(event);
    counts.merge(event.source(), 1L, Long::sum);
  }

  public synchronized List<ErrorEvent> snapshot() {
    return List.copyOf(events);
  }

  public synchronized Map<String, Long> countsBySource() {
    return new LinkedHashMap<>(counts);
  }

  public synchronized long total() {
    return events.size();
  }
}
