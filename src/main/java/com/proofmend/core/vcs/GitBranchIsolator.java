package com.proofmend.core.vcs;

import com.proofmend.core.executor.CommandExecutor;
import com.proofmend.core.executor.CommandResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Creates a scratch git branch so a session's edits stay off the current branch.
 * Outside a work tree, or without git, this is a logged no-op.
 */
@Component
public class GitBranchIsolator {

    private static final Logger log = LoggerFactory.getLogger(GitBranchIsolator.class);

    private static final Duration GIT_TIMEOUT = Duration.ofSeconds(30);
    private static final DateTimeFormatter BRANCH_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final CommandExecutor executor;
    private final Clock clock;

    public GitBranchIsolator(CommandExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * @return the branch that was created, or empty when no branch was created
     */
    public Optional<String> isolate(Path root, String prefix) {

        CommandResult inside = executor.execute(
                List.of("git", "rev-parse", "--is-inside-work-tree"), root, GIT_TIMEOUT);
        if (!inside.isSuccess() || !"true".equals(inside.getStdout().strip())) {
            log.info("[Git] {} is not inside a git work tree; skipping branch creation", root);
            return Optional.empty();
        }

        String branch = prefix + "-" + BRANCH_SUFFIX.format(Instant.now(clock).atZone(clock.getZone()));
        CommandResult checkout = executor.execute(List.of("git", "checkout", "-b", branch), root, GIT_TIMEOUT);
        if (!checkout.isSuccess()) {
            log.warn("[Git] Could not create branch {}: {}", branch, checkout.getErrorText());
            return Optional.empty();
        }

        log.info("[Git] Created branch {}", branch);
        return Optional.of(branch);
    }
}
