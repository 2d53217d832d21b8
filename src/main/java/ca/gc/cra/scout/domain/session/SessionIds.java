package ca.gc.cra.scout.domain.session;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * Generates session identifiers of the form {@code 20261019T142233Z-3f9a}.
 *
 * <p>The timestamp prefix keeps output directories sorted by start time; the random suffix
 * separates sessions started within the same second.</p>
 */
public final class SessionIds {
  private static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
  private static final int SUFFIX_LENGTH = 4;

  private SessionIds() {}

  public static String next(Instant startedAt) {
    Objects.requireNonNull(startedAt, "startedAt");
    String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
    return STAMP.format(startedAt) + "-" + suffix;
  }
}
