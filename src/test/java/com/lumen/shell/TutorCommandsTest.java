package com.lumen.shell;

import com.lumen.exception.ContextUnavailableException;
import com.lumen.exception.GenerationFailureException;
import com.lumen.exception.NotFoundException;
import com.lumen.exception.SessionConflictException;
import com.lumen.exception.SessionNotActiveException;
import com.lumen.exception.UpstreamUnavailableException;
import com.lumen.model.MessageReply;
import com.lumen.model.Session;
import com.lumen.model.SessionStart;
import com.lumen.model.SessionStatus;
import com.lumen.model.SessionWarning;
import com.lumen.service.api.ExternalStateGateway;
import com.lumen.service.api.SessionOrchestrator;
import org.jline.terminal.Terminal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TutorCommandsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Session ACTIVE = Session.start("3f2a9c1e-0000", 42, 9, 1, NOW);

    @Mock private SessionOrchestrator orchestrator;
    @Mock private ExternalStateGateway gateway;
    @Mock private ObjectProvider<BuildProperties> buildProperties;
    @Mock private Terminal terminal;

    private final StringWriter output = new StringWriter();
    private TutorCommands commands;

    @BeforeEach
    void setUp() {
        lenient().when(terminal.writer()).thenReturn(new PrintWriter(output));
        lenient().when(terminal.getWidth()).thenReturn(80);
        commands = new TutorCommands(orchestrator, gateway, buildProperties, terminal);
    }

    @Test
    @DisplayName("start should select the new session and print the opening message")
    void testStart() {
        when(orchestrator.start(42, 9, 1)).thenReturn(CompletableFuture.completedFuture(
                new SessionStart(ACTIVE, "Olá! Vamos começar.", Set.of())));

        commands.start(42, 9, 1);

        assertThat(commands.getCurrentSessionId()).isEqualTo(ACTIVE.id());
        assertThat(output.toString()).contains("Olá! Vamos começar.");
    }

    @Test
    @DisplayName("start should point at the existing session on conflict")
    void testStartConflict() {
        when(orchestrator.start(42, 9, 1)).thenReturn(CompletableFuture.failedFuture(new SessionConflictException("old-id")));

        commands.start(42, 9, 1);

        assertThat(commands.getCurrentSessionId()).isNull();
        assertThat(output.toString()).contains("old-id");
    }

    @Test
    @DisplayName("say should require a selected session")
    void testSayWithoutSession() {
        commands.say(new String[]{"hello"});

        verify(orchestrator, never()).postMessage(anyString(), anyString());
        assertThat(output.toString()).contains("No session selected");
    }

    @Test
    @DisplayName("say should join the words and celebrate a completed topic")
    void testSayCompletesTopic() {
        when(orchestrator.start(42, 9, 1)).thenReturn(CompletableFuture.completedFuture(
                new SessionStart(ACTIVE, "Olá!", Set.of())));
        commands.start(42, 9, 1);
        when(orchestrator.postMessage(ACTIVE.id(), "x = 5")).thenReturn(CompletableFuture.completedFuture(
                new MessageReply(ACTIVE.complete(NOW), "Great job!", true, NOW,
                        Set.of(SessionWarning.COMPLETION_NOTIFICATION_FAILED))));

        commands.say(new String[]{"x", "=", "5"});

        assertThat(output.toString())
                .contains("Great job!")
                .contains("completed this topic")
                .contains("could not be saved");
    }

    @Test
    @DisplayName("abandon should clear the current session")
    void testAbandon() {
        when(orchestrator.start(42, 9, 1)).thenReturn(CompletableFuture.completedFuture(
                new SessionStart(ACTIVE, "Olá!", Set.of())));
        commands.start(42, 9, 1);
        when(orchestrator.abandon(ACTIVE.id())).thenReturn(CompletableFuture.completedFuture(ACTIVE.abandon()));

        commands.abandon(null);

        assertThat(commands.getCurrentSessionId()).isNull();
        assertThat(output.toString()).contains(SessionStatus.ABANDONED.name());
    }

    @Test
    @DisplayName("Each failure kind gets its own message")
    void testDescribe() {
        assertThat(TutorCommands.describe(new NotFoundException("x"))).startsWith("Not found");
        assertThat(TutorCommands.describe(new ContextUnavailableException("x", new NotFoundException("topic"))))
                .startsWith("Not found");
        assertThat(TutorCommands.describe(new ContextUnavailableException("x",
                new UpstreamUnavailableException("down", 5, true, null)))).contains("unavailable");
        assertThat(TutorCommands.describe(new SessionNotActiveException("s", SessionStatus.COMPLETED))).contains("has ended");
        assertThat(TutorCommands.describe(new GenerationFailureException("x", null))).contains("AI tutor did not answer");
        assertThat(TutorCommands.describe(new IllegalArgumentException("too long"))).isEqualTo("Invalid input: too long");
    }

    @Test
    @DisplayName("A request the backend rejected is not presented as a temporary outage")
    void testDescribeRejectedRequest() {
        var rejected = new UpstreamUnavailableException("HTTP 400", 1, false, null);

        assertThat(TutorCommands.describe(rejected)).contains("rejected").doesNotContain("try again later");
        assertThat(TutorCommands.describe(new ContextUnavailableException("x", rejected))).contains("rejected");
        assertThat(TutorCommands.describe(new UpstreamUnavailableException("down", 5, true, null)))
                .contains("try again later");
    }

    @Test
    @DisplayName("health should report the backend state")
    void testHealth() {
        when(gateway.checkHealth()).thenReturn(CompletableFuture.completedFuture(false));

        commands.health();

        assertThat(output.toString()).contains("not reachable");
    }
}
