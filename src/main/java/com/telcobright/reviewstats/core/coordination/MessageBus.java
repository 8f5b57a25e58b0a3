package com.telcobright.reviewstats.core.coordination;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Point-to-point mailboxes for one job. Endpoint {@value #COORDINATOR} is the
 * coordinator, endpoints {@code 1..workers} are the workers.
 * Mailboxes are unbounded; {@link #send} never blocks.
 */
public class MessageBus {
    public static final int COORDINATOR = 0;

    private final List<BlockingQueue<Envelope>> mailboxes;

    public MessageBus(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Need at least 1 worker, got " + workers);
        }
        this.mailboxes = new ArrayList<>(workers + 1);
        for (int i = 0; i <= workers; i++) {
            mailboxes.add(new LinkedBlockingQueue<>());
        }
    }

    public int getWorkerCount() {
        return mailboxes.size() - 1;
    }

    public void send(int source, int destination, Channel channel, Object payload) {
        requireEndpoint(source);
        requireEndpoint(destination);
        mailboxes.get(destination).add(new Envelope(source, destination, channel, payload));
    }

    /**
     * Wait for the next message addressed to {@code endpoint}, whatever its
     * sender or channel.
     */
    public Envelope receive(int endpoint) throws InterruptedException {
        requireEndpoint(endpoint);
        return mailboxes.get(endpoint).take();
    }

    private void requireEndpoint(int endpoint) {
        if (endpoint < 0 || endpoint >= mailboxes.size()) {
            throw new IllegalArgumentException("Unknown endpoint " + endpoint);
        }
    }
}
