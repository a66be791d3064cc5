package com.gateway.protocol;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands inbound messages from transport threads to a single dedicated worker thread.
 * <p>
 * The queue is bounded; when it is full the message is dropped with a warning rather than
 * blocking the transport. Handler exceptions are logged and the worker carries on.
 */
@Slf4j
public class MessageDispatcher implements AutoCloseable {

    private final String name;
    private final BlockingQueue<Delivery> queue;
    private final Thread worker;
    private volatile boolean running = true;

    public MessageDispatcher(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.worker = new Thread(this::drainLoop, name + "-dispatcher");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Queues the message for delivery and returns immediately.
     *
     * @return {@code false} if the message was dropped.
     */
    public boolean dispatch(MessageHandler handler, InboundMessage message) {
        if (!running) {
            log.debug("[{}] Dispatcher closed, dropping message on {}", name, message.channel());
            return false;
        }
        boolean accepted = queue.offer(new Delivery(handler, message));
        if (!accepted) {
            log.warn("[{}] Dispatch queue full, dropping message on channel '{}'", name, message.channel());
        }
        return accepted;
    }

    public int pending() {
        return queue.size();
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            Delivery delivery;
            try {
                delivery = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery == null) {
                continue;
            }
            try {
                delivery.handler().onMessage(delivery.message());
            } catch (RuntimeException e) {
                log.error("[{}] Message handler failed for channel '{}'", name, delivery.message().channel(), e);
            }
        }
    }

    @Override
    public void close() {
        running = false;
        worker.interrupt();
        try {
            worker.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Delivery(MessageHandler handler, InboundMessage message) {
    }
}
