package ca.gc.cra.scout.testutil;

import ca.gc.cra.scout.application.port.CommandResult;
import ca.gc.cra.scout.application.port.PodExecPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Scriptable exec port. Responses are chosen by the first rule whose fragment is contained in the
 * shell script; unmatched commands succeed immediately with empty output.
 */
public final class FakePodExecPort implements PodExecPort {
  public record Call(String namespace, String pod, List<String> command) {
    public String script() {
      if (command.size() == 3 && "sh".equals(command.get(0)) && "-c".equals(command.get(1))) {
        return command.get(2);
      }
      return String.join(" ", command);
    }
  }

  private record Rule(String fragment, Supplier<CompletableFuture<CommandResult>> response) {}

  private final List<Call> calls = new CopyOnWriteArrayList<>();
  private final List<Rule> rules = new CopyOnWriteArrayList<>();
  private final List<CompletableFuture<CommandResult>> hanging = new CopyOnWriteArrayList<>();
  private final Set<String> missingArtifacts = ConcurrentHashMap.newKeySet();
  private final List<String> copies = new CopyOnWriteArrayList<>();

  public FakePodExecPort when(String fragment, Supplier<CompletableFuture<CommandResult>> response) {
    rules.add(new Rule(fragment, response));
    return this;
  }

  public FakePodExecPort exitWith(String fragment, int exitCode) {
    return when(fragment, () -> CompletableFuture.completedFuture(
        new CommandResult(exitCode, "", exitCode == 0 ? "" : "exit " + exitCode)));
  }

  public FakePodExecPort respond(String fragment, CommandResult result) {
    return when(fragment, () -> CompletableFuture.completedFuture(result));
  }

  public FakePodExecPort fail(String fragment, Exception failure) {
    return when(fragment, () -> CompletableFuture.failedFuture(failure));
  }

  /** Commands matching {@code fragment} never finish unless cancelled. */
  public FakePodExecPort hang(String fragment) {
    return when(fragment, () -> {
      CompletableFuture<CommandResult> future = new CompletableFuture<>();
      hanging.add(future);
      return future;
    });
  }

  public FakePodExecPort completeAfter(String fragment, Duration delay, int exitCode) {
    return when(fragment, () -> CompletableFuture.supplyAsync(
        () -> new CommandResult(exitCode, "", ""),
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)));
  }

  public FakePodExecPort missingArtifact(String remoteFragment) {
    missingArtifacts.add(remoteFragment);
    return this;
  }

  @Override
  public CompletableFuture<CommandResult> exec(String namespace, String pod, List<String> command) {
    Call call = new Call(namespace, pod, List.copyOf(command));
    calls.add(call);
    for (Rule rule : rules) {
      if (call.script().contains(rule.fragment())) {
        return rule.response().get();
      }
    }
    return CompletableFuture.completedFuture(new CommandResult(0, "", ""));
  }

  @Override
  public void copyFromPod(String namespace, String pod, String remotePath, Path localFile)
      throws IOException {
    for (String missing : missingArtifacts) {
      if (remotePath.contains(missing)) {
        throw new IOException(pod + ":" + remotePath + " does not exist");
      }
    }
    Files.createDirectories(localFile.toAbsolutePath().getParent());
    Files.writeString(localFile, pod + ":" + remotePath + "\n", StandardCharsets.UTF_8);
    copies.add(pod + ":" + remotePath);
  }

  public List<Call> calls() {
    return List.copyOf(calls);
  }

  public List<String> scripts() {
    return calls.stream().map(Call::script).collect(Collectors.toList());
  }

  public long count(String fragment) {
    return calls.stream().filter(c -> c.script().contains(fragment)).count();
  }

  public List<String> copies() {
    return List.copyOf(copies);
  }

  public long cancelledCount() {
    return hanging.stream().filter(CompletableFuture::isCancelled).count();
  }
}
