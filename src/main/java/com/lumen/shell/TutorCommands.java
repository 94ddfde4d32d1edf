package com.lumen.shell;

import com.lumen.exception.ContextUnavailableException;
import com.lumen.exception.ErrorKind;
import com.lumen.exception.SessionConflictException;
import com.lumen.exception.TutorException;
import com.lumen.exception.UpstreamUnavailableException;
import com.lumen.model.MessageReply;
import com.lumen.model.Session;
import com.lumen.model.SessionDetails;
import com.lumen.model.SessionStart;
import com.lumen.model.SessionWarning;
import com.lumen.model.Turn;
import com.lumen.model.TurnRole;
import com.lumen.service.api.ExternalStateGateway;
import com.lumen.service.api.SessionOrchestrator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The Spring Shell component that lets a learner hold a tutoring session from the terminal.
 * <p>
 * Commands delegate to the {@link SessionOrchestrator} and wait for its result, rendering
 * replies with JLine {@link AttributedString} styles. Each failure kind gets its own message,
 * so a missing topic reads differently from a backend that is down.
 * </p>
 * <p>
 * The shell remembers the session it last started or selected; {@code say}, {@code session}
 * and {@code abandon} act on it unless another id is given.
 * </p>
 */
@ShellComponent
@RequiredArgsConstructor
public class TutorCommands {

    private final SessionOrchestrator orchestrator;
    private final ExternalStateGateway gateway;
    private final ObjectProvider<BuildProperties> buildProperties;
    private final Terminal terminal;

    /**
     * Id of the session that commands act on by default.
     */
    @Getter
    private volatile String currentSessionId;

    // --- UI STYLES (Constants) ---
    private static final AttributedStyle STYLE_HEADER = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold();
    private static final AttributedStyle STYLE_LABEL = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_INFO = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).italic();
    private static final AttributedStyle STYLE_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.RED);
    private static final AttributedStyle STYLE_SUCCESS = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN).bold();
    private static final AttributedStyle STYLE_TUTOR = AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).italic();
    private static final AttributedStyle STYLE_LEARNER = AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);

    // --- COMMANDS ---

    /**
     * Starts a tutoring session and shows the tutor's opening message.
     *
     * @param userId   The learner's id on the training backend.
     * @param topicId  The topic to study.
     * @param courseId The course the topic belongs to.
     */
    @ShellMethod(key = "start", value = "Start a tutoring session on a topic.")
    public void start(
            @ShellOption(value = "--user", help = "The learner's user id.") long userId,
            @ShellOption(value = "--topic", help = "The topic id.") long topicId,
            @ShellOption(value = "--course", help = "The course id.") long courseId
    ) {
        printInfo("Loading your learning context and preparing the tutor...");
        try {
            SessionStart result = await(orchestrator.start(userId, topicId, courseId));
            this.currentSessionId = result.session().id();
            printSuccess("Session " + result.session().id() + " started.");

            if (result.openingMessage() != null) {
                printSection("TUTOR", result.openingMessage());
            }
            printWarnings(result.warnings());
        } catch (SessionConflictException e) {
            printError("You already have an active session on this topic: " + e.getExistingSessionId());
            printInfo("Type 'use " + e.getExistingSessionId() + "' to continue it, or 'abandon' it first.");
        } catch (RuntimeException e) {
            printFailure(e);
        }
    }

    /**
     * Sends a message to the tutor in the current session.
     *
     * @param messageParts The words of the message (captured as an array to avoid quoting requirements).
     */
    @ShellMethod(key = "say", value = "Send a message to the tutor.")
    public void say(@ShellOption(arity = Integer.MAX_VALUE, help = "Your message.") String[] messageParts) {
        if (messageParts == null || messageParts.length == 0) {
            printError("Please type a message after the 'say' command.");
            return;
        }
        if (currentSessionId == null) {
            printInfo("No session selected. Use 'start' or 'use' first.");
            return;
        }
        try {
            MessageReply reply = await(orchestrator.postMessage(currentSessionId, String.join(" ", messageParts)));
            printSection("TUTOR", reply.assistantMessage());
            if (reply.topicCompleted()) {
                printSuccess("Congratulations, you have completed this topic!");
            }
            printWarnings(reply.warnings());
        } catch (RuntimeException e) {
            printFailure(e);
        }
    }

    /**
     * Selects an existing session as the current one.
     */
    @ShellMethod(key = "use", value = "Continue an existing session.")
    public void use(@ShellOption(help = "The session id.") String sessionId) {
        try {
            SessionDetails details = await(orchestrator.getSession(sessionId));
            this.currentSessionId = details.session().id();
            printSuccess("Now using session " + sessionId + " (" + details.session().status() + ").");
        } catch (RuntimeException e) {
            printFailure(e);
        }
    }

    /**
     * Prints a session's status and its conversation so far.
     */
    @ShellMethod(key = "session", value = "Show the status and history of a session.")
    public void session(@ShellOption(defaultValue = ShellOption.NULL, help = "The session id; defaults to the current one.") String sessionId) {
        String id = sessionId != null ? sessionId : currentSessionId;
        if (id == null) {
            printInfo("No session selected. Use 'start' or 'use' first.");
            return;
        }
        try {
            SessionDetails details = await(orchestrator.getSession(id));
            Session session = details.session();

            printHeader("\nSession " + session.id());
            printLabel("Status: " + session.status() + " | user " + session.userId()
                    + " | topic " + session.topicId() + " | course " + session.courseId());
            if (details.context() != null) {
                printLabel("Topic: " + details.context().topicTitle() + " (" + details.context().courseTitle() + ")");
            }
            terminal.writer().println();
            for (Turn turn : details.turns()) {
                terminal.writer().println(formatTurn(turn));
            }
            terminal.writer().flush();
        } catch (RuntimeException e) {
            printFailure(e);
        }
    }

    /**
     * Abandons a session. Ended sessions are left as they are.
     */
    @ShellMethod(key = "abandon", value = "Abandon a session.")
    public void abandon(@ShellOption(defaultValue = ShellOption.NULL, help = "The session id; defaults to the current one.") String sessionId) {
        String id = sessionId != null ? sessionId : currentSessionId;
        if (id == null) {
            printInfo("No session selected.");
            return;
        }
        try {
            Session session = await(orchestrator.abandon(id));
            printInfo("Session " + id + " is now " + session.status() + ".");
            if (id.equals(currentSessionId)) {
                this.currentSessionId = null;
            }
        } catch (RuntimeException e) {
            printFailure(e);
        }
    }

    /**
     * Probes the training backend once.
     */
    @ShellMethod(key = "health", value = "Check whether the training backend is reachable.")
    public void health() {
        if (await(gateway.checkHealth())) {
            printSuccess("Training backend is reachable.");
        } else {
            printError("Training backend is not reachable.");
        }
    }

    /**
     * Outputs the current version of the CLI application from build properties.
     */
    @ShellMethod(key = "version", value = "Display the application version.")
    public void version() {
        BuildProperties properties = buildProperties.getIfAvailable();
        terminal.writer().println("lumen-tutor version " + (properties != null ? properties.getVersion() : "unknown"));
        terminal.writer().flush();
    }

    // --- INTERNAL HELPERS ---

    /**
     * Waits for a result, rethrowing the failure without its {@link CompletionException} wrapper.
     */
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (TutorException.unwrap(e) instanceof RuntimeException failure) {
                throw failure;
            }
            throw e;
        }
    }

    /**
     * Translates a failure into a message the learner can act on.
     */
    static String describe(Throwable failure) {
        if (failure instanceof IllegalArgumentException) {
            return "Invalid input: " + failure.getMessage();
        }
        if (!(failure instanceof TutorException tutorException)) {
            return "Unexpected error: " + failure.getMessage();
        }

        if (rejectedByBackend(tutorException)) {
            return "The training backend rejected the request. Retrying it unchanged will not help.";
        }
        ErrorKind kind = tutorException.getKind();
        if (tutorException instanceof ContextUnavailableException contextUnavailable) {
            kind = contextUnavailable.getUpstreamKind() == ErrorKind.NOT_FOUND
                    ? ErrorKind.NOT_FOUND
                    : ErrorKind.CONTEXT_UNAVAILABLE;
        }
        return switch (kind) {
            case NOT_FOUND -> "Not found: the user, topic or session does not exist.";
            case CONFLICT -> "An active session already exists for this topic.";
            case SESSION_NOT_ACTIVE -> "This session has ended and accepts no more messages.";
            case CONTEXT_UNAVAILABLE, UPSTREAM_UNAVAILABLE -> "The training backend is unavailable right now. Please try again later.";
            case GENERATION_FAILURE -> "The AI tutor did not answer. Your message was kept; please try again.";
        };
    }

    private static boolean rejectedByBackend(TutorException failure) {
        Throwable upstream = failure instanceof ContextUnavailableException ? failure.getCause() : failure;
        return upstream instanceof UpstreamUnavailableException unavailable && !unavailable.isRecoverable();
    }

    private String formatTurn(Turn turn) {
        boolean tutor = turn.role() == TurnRole.ASSISTANT;
        return new AttributedStringBuilder()
                .append(tutor ? "[TUTOR] " : "[YOU]   ", STYLE_LABEL)
                .append(turn.content(), tutor ? STYLE_TUTOR : STYLE_LEARNER)
                .toAnsi();
    }

    private void printWarnings(Set<SessionWarning> warnings) {
        for (SessionWarning warning : warnings) {
            switch (warning) {
                case OPENING_MESSAGE_UNAVAILABLE -> printInfo("The tutor could not prepare an opening message. Say hello to begin.");
                case COMPLETION_NOTIFICATION_FAILED -> printInfo("Your progress could not be saved to the training backend yet.");
            }
        }
    }

    // --- PRINTER UTILITIES ---

    private void printFailure(Throwable failure) {
        printError(describe(failure));
    }

    private void printHeader(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_HEADER).toAnsi());
        printSeparator();
    }

    private void printLabel(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_LABEL).toAnsi());
        terminal.writer().flush();
    }

    private void printInfo(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_INFO).toAnsi());
        terminal.writer().flush();
    }

    private void printError(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_ERROR).toAnsi());
        terminal.writer().flush();
    }

    private void printSuccess(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_SUCCESS).toAnsi());
        terminal.writer().flush();
    }

    private void printSeparator() {
        terminal.writer().println("─".repeat(40));
    }

    private void printSection(String title, String body) {
        String separator = "─".repeat(Math.max(terminal.getWidth(), 40));
        terminal.writer().println("\n" + separator);
        terminal.writer().println(new AttributedString(title + ":", STYLE_HEADER).toAnsi());
        terminal.writer().println(separator + "\n");
        terminal.writer().println(new AttributedString(body, STYLE_TUTOR).toAnsi());
        terminal.writer().println("\n" + separator);
        terminal.writer().flush();
    }
}
