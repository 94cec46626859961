package dev.ito.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GitPort} fake answering from a table keyed by the space-joined arguments.
 * Unknown commands fail with exit status 128, like git outside a repository.
 */
public final class ScriptedGitPort implements GitPort {
  private final Map<String, Result> answers = new HashMap<>();
  private final List<String> invocations = new ArrayList<>();
  private IOException failure;

  public ScriptedGitPort answer(String args, String stdout) {
    answers.put(args, new Result(0, stdout, ""));
    return this;
  }

  public ScriptedGitPort answer(String args, Result result) {
    answers.put(args, result);
    return this;
  }

  public ScriptedGitPort failWith(IOException ex) {
    this.failure = ex;
    return this;
  }

  public List<String> invocations() {
    return List.copyOf(invocations);
  }

  @Override
  public Result run(Path workingDir, List<String> args) throws IOException {
    String key = String.join(" ", args);
    invocations.add(key);
    if (failure != null) {
      throw failure;
    }
    return answers.getOrDefault(key, new Result(128, "", "fatal: not a git repository"));
  }
}
