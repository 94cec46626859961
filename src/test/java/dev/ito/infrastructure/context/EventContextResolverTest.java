package dev.ito.infrastructure.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.application.port.ScriptedGitPort;
import dev.ito.domain.audit.EventContext;
import dev.ito.infrastructure.audit.AuditPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventContextResolverTest {
  @TempDir Path root;

  @Test
  void sessionIdIsCreatedOnceAndReused() throws Exception {
    Path itoDir = Files.createDirectories(root.resolve(".ito"));
    EventContextResolver resolver = new EventContextResolver(new ScriptedGitPort(), name -> null);

    String first = resolver.resolveSessionId(itoDir);
    String second = resolver.resolveSessionId(itoDir);

    assertEquals(first, second);
    assertEquals(first, Files.readString(AuditPaths.sessionFile(itoDir)));
  }

  @Test
  void sessionFileIsNotCreatedWithoutItoDir() {
    Path itoDir = root.resolve(".ito");
    EventContextResolver resolver = new EventContextResolver(new ScriptedGitPort(), name -> null);

    assertFalse(resolver.resolveSessionId(itoDir).isBlank());
    assertFalse(Files.exists(itoDir));
  }

  @Test
  void resolvesGitDetailsAndHarnessSession() throws Exception {
    ScriptedGitPort git = new ScriptedGitPort()
        .answer("symbolic-ref --short HEAD", "feature/login\n")
        .answer("rev-parse --short=8 HEAD", "0a1b2c3d\n")
        .answer("rev-parse --git-dir", ".git\n")
        .answer("rev-parse --git-common-dir", ".git\n");
    Map<String, String> env = Map.of("CLAUDE_SESSION_ID", "harness-42");
    EventContextResolver resolver = new EventContextResolver(git, env::get);

    EventContext context = resolver.resolve(root, Files.createDirectories(root.resolve(".ito")));

    assertEquals("feature/login", context.branch());
    assertEquals("0a1b2c3d", context.commit());
    assertEquals("harness-42", context.harnessSessionId());
    assertNull(context.worktree());
  }

  @Test
  void linkedWorktreeIsNamedAfterItsDirectory() {
    ScriptedGitPort git = new ScriptedGitPort()
        .answer("rev-parse --git-dir", "/repo/.git/worktrees/login\n")
        .answer("rev-parse --git-common-dir", "/repo/.git\n")
        .answer("rev-parse --show-toplevel", "/work/login-wt\n");

    EventContext context = new EventContextResolver(git, name -> null).resolve(root, root.resolve(".ito"));

    assertEquals("login-wt", context.worktree());
  }

  @Test
  void gitFailureLeavesFieldsEmpty() {
    ScriptedGitPort git = new ScriptedGitPort().failWith(new IOException("no git"));

    EventContext context = new EventContextResolver(git, name -> null).resolve(root, root.resolve(".ito"));

    assertNull(context.branch());
    assertNull(context.commit());
    assertTrue(context.sessionId().length() > 10);
  }

  @Test
  void identityComesFromGitThenUser() {
    ScriptedGitPort git = new ScriptedGitPort().answer("config user.name", "Jane Doe\n");
    assertEquals("@jane-doe", new EventContextResolver(git, name -> null).resolveUserIdentity(root));

    EventContextResolver noGit = new EventContextResolver(new ScriptedGitPort(), Map.of("USER", "ci")::get);
    assertEquals("@ci", noGit.resolveUserIdentity(root));
  }
}
