package dev.ito.infrastructure.context;

import dev.ito.application.port.GitPort;
import dev.ito.domain.audit.EventContext;
import dev.ito.infrastructure.audit.AuditPaths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the correlation context and actor identity stamped on new events.
 *
 * <p>Every lookup is best effort: missing git, a non-repository directory or an unwritable session file leave
 * the corresponding field empty rather than failing the audited operation.</p>
 *
 * @since 0.1.0
 */
public final class EventContextResolver {
  private static final Logger log = LoggerFactory.getLogger(EventContextResolver.class);
  static final List<String> HARNESS_SESSION_VARIABLES = List.of(
      "ITO_HARNESS_SESSION_ID", "CLAUDE_SESSION_ID", "OPENCODE_SESSION_ID", "CODEX_SESSION_ID");

  private final GitPort git;
  private final UnaryOperator<String> environment;

  public EventContextResolver(GitPort git) {
    this(git, System::getenv);
  }

  public EventContextResolver(GitPort git, UnaryOperator<String> environment) {
    this.git = Objects.requireNonNull(git, "git");
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  /**
   * Resolves the full context for a project.
   *
   * @param projectRoot project working directory
   * @param itoDir project state directory
   * @return context with a session id and whatever git details are available
   */
  public EventContext resolve(Path projectRoot, Path itoDir) {
    return new EventContext(
        resolveSessionId(itoDir),
        resolveHarnessSessionId().orElse(null),
        git(projectRoot, "symbolic-ref", "--short", "HEAD").orElse(null),
        detectWorktreeName(projectRoot).orElse(null),
        git(projectRoot, "rev-parse", "--short=8", "HEAD").orElse(null));
  }

  /**
   * Reads the session id from the session file, creating a new UUID when absent.
   *
   * @param itoDir project state directory
   * @return session id; never blank
   */
  public String resolveSessionId(Path itoDir) {
    Path sessionFile = AuditPaths.sessionFile(itoDir);
    if (Files.isRegularFile(sessionFile)) {
      try {
        String existing = Files.readString(sessionFile, StandardCharsets.UTF_8).strip();
        if (!existing.isEmpty()) {
          return existing;
        }
      } catch (IOException ex) {
        log.warn("Unable to read audit session file {}: {}", sessionFile, ex.getMessage());
      }
    }
    String id = UUID.randomUUID().toString();
    if (Files.isDirectory(itoDir)) {
      try {
        Files.createDirectories(sessionFile.getParent());
        Files.writeString(sessionFile, id, StandardCharsets.UTF_8);
      } catch (IOException ex) {
        log.warn("Unable to persist audit session id to {}: {}", sessionFile, ex.getMessage());
      }
    }
    return id;
  }

  /**
   * Returns the first non-empty harness session variable.
   *
   * @return harness session id, if any
   */
  public Optional<String> resolveHarnessSessionId() {
    for (String name : HARNESS_SESSION_VARIABLES) {
      String value = environment.apply(name);
      if (value != null && !value.isBlank()) {
        return Optional.of(value.strip());
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the {@code by} identity: git {@code user.name}, else {@code $USER}, as {@code @lower-hyphenated}.
   *
   * @param projectRoot project working directory
   * @return identity such as {@code @jane-doe}
   */
  public String resolveUserIdentity(Path projectRoot) {
    String name = git(projectRoot, "config", "user.name")
        .or(() -> Optional.ofNullable(environment.apply("USER")).filter(v -> !v.isBlank()))
        .orElse("unknown");
    return "@" + name.strip().toLowerCase(Locale.ROOT).replace(' ', '-');
  }

  private Optional<String> detectWorktreeName(Path projectRoot) {
    Optional<String> gitDir = git(projectRoot, "rev-parse", "--git-dir");
    Optional<String> commonDir = git(projectRoot, "rev-parse", "--git-common-dir");
    if (gitDir.isEmpty() || commonDir.isEmpty()) {
      return Optional.empty();
    }
    Path gitPath = projectRoot.resolve(gitDir.get()).normalize();
    Path commonPath = projectRoot.resolve(commonDir.get()).normalize();
    if (gitPath.equals(commonPath)) {
      return Optional.empty();
    }
    return git(projectRoot, "rev-parse", "--show-toplevel")
        .map(Path::of)
        .map(Path::getFileName)
        .map(Path::toString);
  }

  private Optional<String> git(Path workingDir, String... args) {
    try {
      GitPort.Result result = git.run(workingDir, List.of(args));
      if (!result.succeeded()) {
        return Optional.empty();
      }
      String out = result.stdout().strip();
      return out.isEmpty() ? Optional.empty() : Optional.of(out);
    } catch (IOException ex) {
      log.debug("git {} unavailable in {}: {}", String.join(" ", args), workingDir, ex.getMessage());
      return Optional.empty();
    }
  }
}
