package com.telcobright.reviewstats.core.coordination;

/**
 * A message in transit: who sent it, to whom, on which channel.
 */
public final class Envelope {
    private final int source;
    private final int destination;
    private final Channel channel;
    private final Object payload;

    public Envelope(int source, int destination, Channel channel, Object payload) {
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        this.source = source;
        this.destination = destination;
        this.channel = channel;
        this.payload = payload;
    }

    public int getSource() { return source; }
    public int getDestination() { return destination; }
    public Channel getChannel() { return channel; }
    public Object getPayload() { return payload; }

    public <T> T getPayload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Expected " + type.getSimpleName() + " on " + channel
                + " from endpoint " + source + ", got " + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return "Envelope{" + source + " -> " + destination + ", " + channel + '}';
    }
}
