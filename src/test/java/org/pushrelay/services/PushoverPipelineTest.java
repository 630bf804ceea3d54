package org.pushrelay.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pushrelay.events.EventInbox;
import org.pushrelay.notifications.MustacheTemplateResolver;
import org.pushrelay.notifications.pushover.AttachmentFetcher;
import org.pushrelay.notifications.pushover.HttpImageDownloader;
import org.pushrelay.notifications.pushover.PushoverField;
import org.pushrelay.notifications.pushover.PushoverSender;
import org.pushrelay.services.tasks.PushoverDeliveryTask;
import org.pushrelay.testutil.MutableClock;
import org.pushrelay.testutil.StubHttpServer;
import org.pushrelay.testutil.StubHttpServer.RecordedRequest;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Inbox to Pushover request, with only the network endpoints stubbed.
 */
class PushoverPipelineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final EventInbox inbox = new EventInbox(clock);

    private StubHttpServer remote;
    private PushoverSender sender;
    private PushoverAgent agent;
    private PushoverDeliveryTask task;

    @BeforeEach
    void setUp() {
        remote = new StubHttpServer();
        sender = new PushoverSender(remote.uri("/1/messages.json"), Duration.ofSeconds(2), Duration.ofSeconds(5));

        Map<PushoverField, String> templates = new EnumMap<>(PushoverField.class);
        for (PushoverField field : PushoverField.values()) {
            templates.put(field, field.defaultTemplate());
        }
        templates.put(PushoverField.TOKEN, "T");
        templates.put(PushoverField.USER, "U");
        templates.put(PushoverField.HTML, "{{html}}");

        agent = new PushoverAgent(
                new MustacheTemplateResolver(templates),
                new AttachmentFetcher(new HttpImageDownloader(Duration.ofSeconds(2), Duration.ofSeconds(5))),
                sender,
                new AgentStatus(clock),
                2);
        task = new PushoverDeliveryTask(inbox, agent, 1, 10);
    }

    @AfterEach
    void tearDown() throws IOException {
        sender.close();
        remote.close();
    }

    @Test
    void minimalEventSendsExactlyTheRequiredParameters() {
        inbox.offer(Map.of("message", "hi"));

        task.execute();

        assertThat(remote.requests()).singleElement().satisfies(request -> {
            assertThat(request.query()).containsExactly(
                    Map.entry("token", "T"),
                    Map.entry("user", "U"),
                    Map.entry("message", "hi"));
            assertThat(request.hasAttachment()).isFalse();
        });
        assertThat(agent.isWorking()).isTrue();
    }

    @Test
    void imageUrlTurnsTheRequestIntoAMultipartUpload() {
        byte[] gif = {'G', 'I', 'F', '8', '9', 'a'};
        remote.image("/cat.gif", "image/gif", gif);
        inbox.offer(Map.of(
                "message", "100% cat",
                "title", "Cat",
                "image_url", remote.uri("/cat.gif").toString()));

        task.execute();

        RecordedRequest request = remote.requests().get(0);
        assertThat(request.query())
                .containsEntry("message", "100 percent cat")
                .containsEntry("title", "Cat")
                .doesNotContainKey("image_url");
        assertThat(request.attachment()).isEqualTo(gif);
        assertThat(request.attachmentFileName()).isEqualTo("cat.gif");
    }

    @Test
    void htmlFlagFollowsThePayload() {
        inbox.offer(Map.of("message", "<b>bold</b>", "html", true));

        task.execute();

        assertThat(remote.requests().get(0).query())
                .containsEntry("html", "1")
                .containsEntry("message", "<b>bold</b>");
    }

    @Test
    void brokenImageStillSendsTheTextNotification() {
        remote.failing("/missing.png", 404);
        inbox.offer(Map.of("message", "no picture", "image_url", remote.uri("/missing.png").toString()));

        task.execute();

        RecordedRequest request = remote.requests().get(0);
        assertThat(request.hasAttachment()).isFalse();
        assertThat(request.query()).containsEntry("message", "no picture");
    }

    @Test
    void eventsWithoutMessageAreSkippedAndTheRestDelivered() {
        inbox.offer(Map.of("title", "nothing to say"));
        inbox.offer(Map.of("message", "second"));

        task.execute();

        assertThat(remote.requests()).extracting(r -> r.query().get("message")).containsExactly("second");
        assertThat(inbox.size()).isZero();
    }

    @Test
    void agentStopsWorkingWhenEventsDryUp() {
        inbox.offer(Map.of("message", "hi"));
        task.execute();
        assertThat(agent.isWorking()).isTrue();

        clock.advance(Duration.ofDays(2).plusSeconds(1));

        assertThat(agent.isWorking()).isFalse();
    }
}
