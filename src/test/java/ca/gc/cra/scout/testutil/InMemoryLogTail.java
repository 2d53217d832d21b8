package ca.gc.cra.scout.testutil;

import ca.gc.cra.scout.application.port.LogTailPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Mutable in-memory filesystem for log watcher tests. */
public final class InMemoryLogTail implements LogTailPort {
  private final Map<String, byte[]> files = new HashMap<>();
  private final Map<String, Set<String>> directories = new HashMap<>();
  private final Set<String> failing = new LinkedHashSet<>();
  private final Map<String, RuntimeException> broken = new HashMap<>();
  private final Map<String, Integer> statCalls = new HashMap<>();

  public synchronized InMemoryLogTail append(String path, String text) {
    byte[] existing = files.getOrDefault(path, new byte[0]);
    byte[] extra = text.getBytes(StandardCharsets.UTF_8);
    byte[] merged = Arrays.copyOf(existing, existing.length + extra.length);
    System.arraycopy(extra, 0, merged, existing.length, extra.length);
    files.put(path, merged);
    return this;
  }

  public synchronized InMemoryLogTail replace(String path, String text) {
    files.put(path, text.getBytes(StandardCharsets.UTF_8));
    return this;
  }

  public synchronized InMemoryLogTail mkdir(String path, String... entries) {
    directories.computeIfAbsent(path, k -> new LinkedHashSet<>()).addAll(Arrays.asList(entries));
    return this;
  }

  public synchronized InMemoryLogTail addEntry(String directory, String name) {
    directories.computeIfAbsent(directory, k -> new LinkedHashSet<>()).add(name);
    return this;
  }

  public synchronized InMemoryLogTail remove(String path) {
    files.remove(path);
    directories.remove(path);
    return this;
  }

  public synchronized InMemoryLogTail failing(String path, boolean fail) {
    if (fail) {
      failing.add(path);
    } else {
      failing.remove(path);
    }
    return this;
  }

  /** Makes {@code stat} throw {@code failure} for {@code path}; {@code null} clears it. */
  public synchronized InMemoryLogTail breaking(String path, RuntimeException failure) {
    if (failure == null) {
      broken.remove(path);
    } else {
      broken.put(path, failure);
    }
    return this;
  }

  public synchronized int statCount(String path) {
    return statCalls.getOrDefault(path, 0);
  }

  @Override
  public synchronized PathStatus stat(String path) throws IOException {
    statCalls.merge(path, 1, Integer::sum);
    if (broken.containsKey(path)) {
      throw broken.get(path);
    }
    if (failing.contains(path)) {
      throw new IOException("permission denied");
    }
    if (files.containsKey(path)) {
      return PathStatus.file(files.get(path).length);
    }
    if (directories.containsKey(path)) {
      return PathStatus.directory();
    }
    return PathStatus.missing();
  }

  @Override
  public synchronized byte[] read(String path, long offset, int maxBytes) throws IOException {
    byte[] content = files.get(path);
    if (content == null) {
      throw new IOException(path + " does not exist");
    }
    if (offset >= content.length) {
      return new byte[0];
    }
    int end = (int) Math.min(content.length, offset + maxBytes);
    return Arrays.copyOfRange(content, (int) offset, end);
  }

  @Override
  public synchronized List<String> list(String directory) throws IOException {
    Set<String> entries = directories.get(directory);
    if (entries == null) {
      throw new IOException(directory + " is not a directory");
    }
    return new ArrayList<>(entries);
  }
}
