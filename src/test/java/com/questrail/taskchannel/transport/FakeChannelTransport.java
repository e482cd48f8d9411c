package com.questrail.taskchannel.transport;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeChannelTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link ChannelTransport}. Every {@link #open} call creates a
 * {@link FakeConnection} that the test drives explicitly: complete the handshake,
 * inject inbound payloads, drop the socket.
 *
 * <p>Contains no channel semantics; it only records what was written and closed.</p>
 */
public final class FakeChannelTransport implements ChannelTransport {

    private final List<FakeConnection> connections = new ArrayList<>();
    private final List<URI> openedUris = new ArrayList<>();
    private RuntimeException openFailure;
    private boolean openSynchronously;

    @Override
    public TransportConnection open(URI uri, ChannelTransportListener listener) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");
        openedUris.add(uri);

        if (openFailure != null) {
            throw openFailure;
        }

        FakeConnection connection = new FakeConnection(listener);
        connections.add(connection);
        if (openSynchronously) {
            connection.completeOpen();
        }
        return connection;
    }

    // ---------------------------------------------------------------------
    // Test controls
    // ---------------------------------------------------------------------

    /**
     * Make subsequent {@link #open} calls throw instead of returning a connection.
     */
    public void failOpensWith(RuntimeException failure) {
        this.openFailure = failure;
    }

    /**
     * Complete the handshake inside {@link #open} itself.
     */
    public void openSynchronously(boolean value) {
        this.openSynchronously = value;
    }

    public int openCount() {
        return openedUris.size();
    }

    public List<URI> openedUris() {
        return Collections.unmodifiableList(openedUris);
    }

    public List<FakeConnection> connections() {
        return Collections.unmodifiableList(connections);
    }

    public FakeConnection last() {
        if (connections.isEmpty()) {
            throw new IllegalStateException("No connection opened");
        }
        return connections.get(connections.size() - 1);
    }

    public static final class FakeConnection implements TransportConnection {

        public record Closed(int code, String reason) {}

        private final ChannelTransportListener listener;
        private final List<String> sent = new ArrayList<>();
        private boolean open;
        private boolean refuseWrites;
        private Closed closed;

        private FakeConnection(ChannelTransportListener listener) {
            this.listener = listener;
        }

        @Override
        public boolean send(String payload) {
            Objects.requireNonNull(payload, "payload");
            if (!open || closed != null || refuseWrites) {
                return false;
            }
            sent.add(payload);
            return true;
        }

        @Override
        public void close(int code, String reason) {
            if (closed != null) {
                return;
            }
            closed = new Closed(code, reason);
            open = false;
            // Real transports report the close back to the listener.
            listener.onClose(code, reason, null);
        }

        // -----------------------------------------------------------------
        // Server-side simulation
        // -----------------------------------------------------------------

        public void completeOpen() {
            if (closed != null) {
                throw new IllegalStateException("Connection already closed");
            }
            open = true;
            listener.onOpen(this);
        }

        public void failOpen(Throwable cause) {
            closed = new Closed(ABNORMAL_CLOSURE, "Connect failed");
            listener.onClose(ABNORMAL_CLOSURE, "Connect failed", cause);
        }

        public void receive(String payload) {
            listener.onMessage(payload);
        }

        public void serverClose(int code, String reason) {
            open = false;
            closed = new Closed(code, reason);
            listener.onClose(code, reason, null);
        }

        public void drop() {
            open = false;
            closed = new Closed(ABNORMAL_CLOSURE, "");
            listener.onClose(ABNORMAL_CLOSURE, "", new IOException("Connection reset"));
        }

        public void refuseWrites(boolean value) {
            this.refuseWrites = value;
        }

        public boolean isOpen() {
            return open;
        }

        public Closed closed() {
            return closed;
        }

        public List<String> sent() {
            return Collections.unmodifiableList(sent);
        }

        public void clearSent() {
            sent.clear();
        }
    }
}
