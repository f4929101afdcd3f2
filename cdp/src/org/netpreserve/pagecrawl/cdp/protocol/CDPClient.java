package org.netpreserve.pagecrawl.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-level connection. Routes messages carrying a session id to the matching {@link CDPSession}.
 */
public class CDPClient extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong idSeq = new AtomicLong();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this.rpc = new RPC.Socket(devtoolsUrl, this::handleMessage, this::handleRpcClose);
    }

    public CDPClient(InputStream inputStream, OutputStream outputStream) {
        this.rpc = new RPC.Pipe(inputStream, outputStream, this::handleMessage, this::handleRpcClose);
    }

    @Override
    public void close() {
        rpc.close();
        super.close();
    }

    /**
     * Waits for the browser to drop the connection, e.g. after {@code Browser.close}.
     */
    public void waitClose(Duration timeout) throws InterruptedException {
        try {
            closed.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Connection still open after {}", timeout);
        } catch (ExecutionException e) {
            log.debug("Connection closed abnormally", e.getCause());
        }
    }

    public boolean isClosed() {
        return closed.isDone();
    }

    /**
     * Marks the session as gone when the browser reports its target detached or crashed.
     */
    public void markDetached(String sessionId) {
        var session = sessions.get(sessionId);
        if (session != null) session.markDetached();
    }

    @Override
    protected void handleRpcClose() {
        if (closed.isDone()) return;
        super.handleRpcClose();
        sessions.values().forEach(CDPSession::handleRpcClose);
        closed.complete(null);
    }

    @Override
    protected void handleMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            super.handleMessage(message);
            return;
        }
        var session = sessions.get(message.sessionId());
        if (session != null) {
            session.handleMessage(message);
        } else {
            log.debug("Ignoring CDP message for unknown session: {}", message);
        }
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return idSeq.incrementAndGet();
    }
}
