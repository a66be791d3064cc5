package com.gateway.protocol;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class MessageDispatcherTest {

    private MessageDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    void dispatch_deliversOffTheCallingThread() {
        dispatcher = new MessageDispatcher("test", 16);
        List<String> threads = new CopyOnWriteArrayList<>();

        dispatcher.dispatch(message -> threads.add(Thread.currentThread().getName()), message("a"));

        await().atMost(Duration.ofSeconds(2)).until(() -> threads.size() == 1);
        assertThat(threads.get(0)).isEqualTo("test-dispatcher").isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    void dispatch_keepsOrderAndSurvivesFailingHandlers() {
        dispatcher = new MessageDispatcher("test", 16);
        List<String> received = new CopyOnWriteArrayList<>();
        MessageHandler handler = message -> {
            if ("boom".equals(message.payload())) {
                throw new IllegalStateException("handler failure");
            }
            received.add((String) message.payload());
        };

        dispatcher.dispatch(handler, message("one"));
        dispatcher.dispatch(handler, message("boom"));
        dispatcher.dispatch(handler, message("two"));

        await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 2);
        assertThat(received).containsExactly("one", "two");
    }

    @Test
    void dispatch_dropsWhenQueueIsFull() throws InterruptedException {
        dispatcher = new MessageDispatcher("test", 1);
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MessageHandler slow = message -> {
            blocked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        assertThat(dispatcher.dispatch(slow, message("first"))).isTrue();
        assertThat(blocked.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(dispatcher.dispatch(slow, message("queued"))).isTrue();
        assertThat(dispatcher.dispatch(slow, message("dropped"))).isFalse();
        release.countDown();
    }

    @Test
    void dispatch_afterCloseIsRejected() {
        dispatcher = new MessageDispatcher("test", 4);
        dispatcher.close();

        assertThat(dispatcher.dispatch(message -> { }, message("late"))).isFalse();
    }

    private static InboundMessage message(String payload) {
        return new InboundMessage("chat", null, Map.of(), payload, Instant.now());
    }
}
