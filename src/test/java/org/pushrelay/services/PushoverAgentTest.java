package org.pushrelay.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pushrelay.events.Event;
import org.pushrelay.notifications.NotificationSender;
import org.pushrelay.notifications.TemplateResolver;
import org.pushrelay.notifications.pushover.Attachment;
import org.pushrelay.notifications.pushover.AttachmentFetcher;
import org.pushrelay.notifications.pushover.PushoverField;
import org.pushrelay.testutil.MutableClock;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PushoverAgentTest {

    @Mock
    private NotificationSender sender;

    @Mock
    private AttachmentFetcher attachments;

    private MutableClock clock;
    private AgentStatus status;

    /** Renders each field straight from the payload key of the same name. */
    private final TemplateResolver payloadResolver = (event, field) -> {
        Object value = event.payload().get(field.key());
        return value == null ? "" : value.toString();
    };

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        status = new AgentStatus(clock);
        lenient().when(attachments.fetch(any())).thenReturn(Optional.empty());
    }

    private PushoverAgent agent(TemplateResolver resolver) {
        return new PushoverAgent(resolver, attachments, sender, status, 1);
    }

    private static Event event(String id, Map<String, Object> payload) {
        return new Event(id, payload, Instant.parse("2026-03-01T09:59:00Z"));
    }

    private static Event message(String id, String message) {
        return event(id, Map.of("token", "T", "user", "U", "message", message));
    }

    @Test
    void minimalEventIsSentInSimpleMode() throws IOException {
        int sent = agent(payloadResolver).receive(List.of(message("e1", "hi")));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        verify(sender).send(params.capture(), isNull());
        assertThat(params.getValue()).containsOnly(
                Map.entry("token", "T"),
                Map.entry("user", "U"),
                Map.entry("message", "hi"));
        assertThat(sent).isEqualTo(1);
    }

    @Test
    void eventWithoutMessageIsSkippedSilently() throws IOException {
        Event noMessage = event("e1", Map.of("token", "T", "user", "U"));

        int sent = agent(payloadResolver).receive(List.of(noMessage));

        assertThat(sent).isZero();
        verify(sender, never()).send(anyMap(), any());
        verify(attachments, never()).fetch(any());
        assertThat(status.lastErrorAt()).isNull();
        assertThat(status.lastReceiveAt()).isNotNull();
    }

    @Test
    void failingEventDoesNotStopTheBatch() throws IOException {
        lenient().doThrow(new IOException("connection reset"))
                .when(sender).send(eq(Map.of("token", "T", "user", "U", "message", "second")), any());

        int sent = agent(payloadResolver).receive(List.of(
                message("e1", "first"),
                message("e2", "second"),
                message("e3", "third")));

        verify(sender, times(3)).send(anyMap(), any());
        assertThat(sent).isEqualTo(2);
        assertThat(status.lastErrorMessage()).contains("e2").contains("connection reset");
        assertThat(agent(payloadResolver).isWorking()).isFalse();
    }

    @Test
    void errorWithoutMessageIsRecordedByType() throws IOException {
        when(sender.send(anyMap(), any())).thenThrow(new ConnectException());

        agent(payloadResolver).receive(List.of(message("e1", "hi")));

        assertThat(status.lastErrorMessage()).isEqualTo("Event e1: ConnectException");
    }

    @Test
    void renderingFailureIsIsolatedToItsEvent() throws IOException {
        TemplateResolver flaky = (event, field) -> {
            if (event.id().equals("bad")) throw new IllegalStateException("template blew up");
            return payloadResolver.resolve(event, field);
        };

        int sent = agent(flaky).receive(List.of(message("bad", "x"), message("good", "y")));

        assertThat(sent).isEqualTo(1);
        verify(sender).send(eq(Map.of("token", "T", "user", "U", "message", "y")), any());
    }

    @Test
    void imageUrlIsResolvedIntoAttachment() throws IOException {
        Attachment image = new Attachment("https://img/x.png", "x.png", "image/png", new byte[]{1}, null);
        when(attachments.fetch("https://img/x.png")).thenReturn(Optional.of(image));
        Event withImage = event("e1", Map.of(
                "token", "T", "user", "U", "message", "look", "image_url", "https://img/x.png"));

        agent(payloadResolver).receive(List.of(withImage));

        verify(sender).send(eq(Map.of("token", "T", "user", "U", "message", "look")), eq(image));
    }

    @Test
    void optionalFieldsFlowThroughRules() throws IOException {
        Event rich = event("e1", Map.of(
                "token", "T", "user", "U", "message", "m",
                "url", "u".repeat(600),
                "html", "true",
                "priority", "1"));

        agent(payloadResolver).receive(List.of(rich));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        verify(sender).send(params.capture(), isNull());
        assertThat(params.getValue())
                .containsEntry("html", "1")
                .containsEntry("priority", "1")
                .doesNotContainKey("image_url");
        assertThat(params.getValue().get("url")).hasSize(512);
    }

    @Test
    void everyFieldIsRenderedOncePerEvent() {
        PushoverAgent agent = agent(payloadResolver);

        Map<PushoverField, String> rendered = agent.render(message("e1", "hi"));

        assertThat(rendered).containsOnlyKeys(PushoverField.values());
        assertThat(rendered.get(PushoverField.MESSAGE)).isEqualTo("hi");
    }

    @Test
    void healthyAfterCleanBatch() {
        PushoverAgent agent = agent(payloadResolver);

        agent.receive(List.of(message("e1", "hi")));

        assertThat(agent.isWorking()).isTrue();
    }
}
