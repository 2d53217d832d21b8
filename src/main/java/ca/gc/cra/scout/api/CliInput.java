package ca.gc.cra.scout.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and key/value pairs.
 *
 * <p>Option forms that take the next argument as their value ({@code -n default},
 * {@code --pods "uecm gateway"}) are rewritten to {@code key=value} so the rest of the CLI only
 * deals with one shape.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, String> VALUE_OPTIONS = Map.of(
      "-n", "namespace",
      "--namespace", "namespace",
      "-p", "pods",
      "--pods", "pods",
      "-c", "config",
      "--config", "config",
      "-o", "out",
      "--out", "out");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   * @throws IllegalArgumentException if a value option is the last argument
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (int i = 0; i < args.length; i++) {
      String raw = args[i];
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      String optionKey = VALUE_OPTIONS.get(lower);
      if (optionKey != null) {
        if (i + 1 >= args.length || args[i + 1] == null) {
          throw new IllegalArgumentException("option " + arg + " requires a value");
        }
        kv.add(optionKey + "=" + args[++i].trim());
        continue;
      }
      if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
        continue;
      }
      if (arg.startsWith("--") && arg.contains("=")) {
        String stripped = arg.substring(2);
        String key = stripped.substring(0, stripped.indexOf('=')).toLowerCase(Locale.ROOT);
        String canonical = VALUE_OPTIONS.get("--" + key);
        kv.add(canonical == null ? stripped : canonical + stripped.substring(stripped.indexOf('=')));
        continue;
      }
      kv.add(arg);
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns a copy of the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
