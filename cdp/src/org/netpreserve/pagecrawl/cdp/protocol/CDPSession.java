package org.netpreserve.pagecrawl.cdp.protocol;

import org.netpreserve.pagecrawl.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * A flattened session attached to a single target (tab).
 */
public class CDPSession extends CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private final String sessionId;
    private final String targetId;
    private final CDPClient client;
    private volatile boolean detached;

    public CDPSession(CDPClient client, String sessionId, String targetId) {
        this.client = client;
        this.sessionId = sessionId;
        this.targetId = targetId;
        client.sessions.put(sessionId, this);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.rpc.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    void markDetached() {
        detached = true;
    }

    @Override
    protected void handleRpcClose() {
        detached = true;
        super.handleRpcClose();
    }

    /**
     * True while the target exists and the browser connection is open.
     */
    public boolean isAttached() {
        return !detached && !client.isClosed();
    }

    @Override
    public void close() {
        if (isAttached()) {
            try {
                client.domain(Target.class).closeTarget(targetId);
            } catch (CDPException e) {
                log.warn("Error closing target {}", targetId, e);
            }
        }
        detached = true;
        client.sessions.remove(sessionId);
        super.close();
    }

    public String targetId() {
        return targetId;
    }

    public String sessionId() {
        return sessionId;
    }
}
