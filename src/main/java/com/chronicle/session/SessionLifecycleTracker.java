package com.chronicle.session;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.HookContext;
import com.chronicle.event.HookEvent;
import com.chronicle.event.SessionStartEvent;
import com.chronicle.event.StopEvent;
import com.chronicle.storage.PersistenceManager;
import com.chronicle.storage.SaveResult;
import com.chronicle.storage.SessionEndOutcome;
import com.chronicle.storage.SessionRecord;

/**
 * Session creation and termination on top of {@link PersistenceManager}. Sessions are created on
 * SessionStart or lazily by the first event that names them; the end time is written once.
 */
public class SessionLifecycleTracker {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleTracker.class);

    private static final Set<String> DEFAULT_BRANCHES = Set.of("main", "master");

    private final PersistenceManager persistence;
    private final GitInfoResolver gitInfoResolver;
    private final ProjectTypeDetector projectTypeDetector;

    public SessionLifecycleTracker(PersistenceManager persistence, GitInfoResolver gitInfoResolver,
            ProjectTypeDetector projectTypeDetector) {
        this.persistence = persistence;
        this.gitInfoResolver = gitInfoResolver;
        this.projectTypeDetector = projectTypeDetector;
    }

    public static SessionLifecycleTracker fromContext(HookContext context, PersistenceManager persistence) {
        GitInfoResolver git = new GitInfoResolver(context.getConfig().isGitDetectEnabled(),
                Math.min(500, context.getConfig().getBackendTimeoutMs()));
        return new SessionLifecycleTracker(persistence, git, new ProjectTypeDetector());
    }

    /**
     * Upserts the session with project and git context and builds the context line
     * returned to the agent.
     */
    public SessionStartOutcome startSession(SessionStartEvent event) {
        Optional<Path> projectDir = event.getWorkingDirectory().flatMap(SessionLifecycleTracker::toPath);
        GitInfo git = projectDir.map(gitInfoResolver::resolve).orElse(GitInfo.none());
        Optional<String> projectType = projectDir.flatMap(projectTypeDetector::detect);

        SessionRecord session = SessionRecord.builder(event.getExternalSessionId(), event.getTimestamp())
                .projectPath(event.getWorkingDirectory().orElse(null))
                .gitBranch(git.getBranch().orElse(null))
                .gitCommit(git.getCommit().orElse(null))
                .source(event.getSource())
                .build();

        SaveResult result = persistence.saveSession(session);
        logger.info("Session start {} ({}) -> {}", event.getExternalSessionId(), event.getSource(), result);

        Map<String, Object> eventData = new LinkedHashMap<>();
        session.getProjectPath().ifPresent(p -> eventData.put("project_path", p));
        git.getBranch().ifPresent(b -> eventData.put("git_branch", b));
        git.getCommit().ifPresent(c -> eventData.put("git_commit", c));
        projectType.ifPresent(t -> eventData.put("project_type", t));

        return new SessionStartOutcome(result, session, eventData,
                buildContext(git, projectType, event.getSource()).orElse(null));
    }

    /**
     * Sets the end time if not already set and returns the aggregates derived from the log.
     * A Stop for a session never seen before creates it first.
     */
    public SessionEndOutcome endSession(StopEvent event) {
        SessionEndOutcome outcome = persistence.endSession(sessionFor(event), event.getTimestamp());
        if (outcome.isOk() && !outcome.isEndedNow()) {
            logger.info("Session {} already ended, keeping first end time", event.getExternalSessionId());
        }
        return outcome;
    }

    /**
     * The session to create when an event references one the store has never seen.
     */
    public SessionRecord sessionFor(HookEvent event) {
        return SessionRecord.builder(event.getExternalSessionId(), event.getTimestamp())
                .projectPath(event.getWorkingDirectory().orElse(null))
                .build();
    }

    static Optional<String> buildContext(GitInfo git, Optional<String> projectType, String source) {
        List<String> parts = new ArrayList<>();
        git.getBranch()
                .filter(b -> !DEFAULT_BRANCHES.contains(b) && !"HEAD".equals(b))
                .ifPresent(b -> parts.add("You're working on branch '" + b + "'"));
        projectType.ifPresent(t -> parts.add("Detected " + t + " project"));
        if ("resume".equals(source)) {
            parts.add("Resuming previous session");
        } else if ("clear".equals(source)) {
            parts.add("Starting fresh session (context cleared)");
        }
        return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(" | ", parts));
    }

    private static Optional<Path> toPath(String value) {
        try {
            return Optional.of(Paths.get(value));
        } catch (InvalidPathException e) {
            logger.debug("Ignoring invalid working directory {}: {}", value, e.getMessage());
            return Optional.empty();
        }
    }
}
