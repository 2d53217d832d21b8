package ca.gc.cra.scout.application.session;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Case-sensitive substring matcher over the configured error keywords.
 *
 * <p>{@code "Error"} does not match the keyword {@code "error"}; callers that want both spellings
 * list both.</p>
 */
public final class KeywordMatcher {
  private final List<String> keywords;

  public KeywordMatcher(List<String> keywords) {
    this.keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
    if (this.keywords.isEmpty()) {
      throw new IllegalArgumentException("at least one keyword is required");
    }
    for (String keyword : this.keywords) {
      if (keyword.isEmpty()) {
        throw new IllegalArgumentException("keywords must not be empty");
      }
    }
  }

  public boolean matches(String line) {
    return firstMatch(line).isPresent();
  }

  /**
   * Returns the first keyword, in configuration order, contained in {@code line}.
   *
   * @param line candidate line; {@code null} never matches
   * @return matching keyword, if any
   */
  public Optional<String> firstMatch(String line) {
    if (line == null || line.isEmpty()) {
      return Optional.empty();
    }
    for (String keyword : keywords) {
      if (line.contains(keyword)) {
        return Optional.of(keyword);
      }
    }
    return Optional.empty();
  }

  public List<String> keywords() {
    return keywords;
  }
}
