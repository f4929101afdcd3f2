package org.netpreserve.pagecrawl.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Shares a small number of expensive renderer sessions between workers. A session is handed to one worker at a time
 * and returned with {@link #release(RendererSession)}. New sessions are only created when every live session is in
 * use, and sessions are only destroyed when found dead or at {@link #teardownAll()}.
 */
public class RendererPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RendererPool.class);
    private final SessionFactory factory;
    private final List<Slot> slots = new ArrayList<>();
    private boolean closed;

    private static class Slot {
        final RendererSession session;
        final boolean isolated;
        boolean inUse;
        boolean instrumented;

        Slot(RendererSession session, boolean isolated) {
            this.session = session;
            this.isolated = isolated;
        }
    }

    public RendererPool(SessionFactory factory) {
        this.factory = factory;
    }

    /**
     * Hands out a free live session of the requested kind, creating one if none is free. The throttling bypass is
     * applied once per session, the first time it is acquired.
     *
     * @throws RenderException if the pool is closed, a session couldn't be created or the throttling bypass couldn't
     *                         be attached. A session that fails the bypass is closed and removed from the pool.
     */
    public RendererSession acquire(boolean isolated) throws RenderException {
        Slot slot = claimFree(isolated);
        if (slot == null) {
            RendererSession session = factory.create(isolated);
            slot = new Slot(session, isolated);
            slot.inUse = true;
            synchronized (this) {
                if (closed) {
                    session.close();
                    throw new RenderException("Renderer pool is closed");
                }
                slots.add(slot);
            }
            log.atDebug().addKeyValue("session", session.id()).addKeyValue("isolated", isolated)
                    .log("Created renderer session");
        }
        instrument(slot);
        return slot.session;
    }

    private synchronized Slot claimFree(boolean isolated) throws RenderException {
        if (closed) throw new RenderException("Renderer pool is closed");
        for (Iterator<Slot> it = slots.iterator(); it.hasNext(); ) {
            Slot slot = it.next();
            if (slot.inUse) continue;
            if (!slot.session.isAlive()) {
                log.info("Discarding dead renderer session {}", slot.session.id());
                it.remove();
                closeQuietly(slot.session);
                continue;
            }
            if (slot.isolated == isolated) {
                slot.inUse = true;
                return slot;
            }
        }
        return null;
    }

    private void instrument(Slot slot) throws RenderException {
        if (slot.instrumented) return;
        try {
            slot.session.disableThrottling();
            slot.instrumented = true;
        } catch (RenderException | RuntimeException e) {
            log.warn("Unable to disable throttling for session {}, discarding it: {}", slot.session.id(),
                    e.getMessage());
            synchronized (this) {
                slots.remove(slot);
            }
            closeQuietly(slot.session);
            if (e instanceof RenderException renderException) throw renderException;
            throw new RenderException("Failed to attach to session " + slot.session.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns a session to the pool. The session stays open for the next worker.
     */
    public synchronized void release(RendererSession session) {
        for (Slot slot : slots) {
            if (slot.session == session) {
                slot.inUse = false;
                return;
            }
        }
        log.debug("Released session {} that is not in the pool", session.id());
    }

    public synchronized int size() {
        return slots.size();
    }

    public synchronized int inUse() {
        int count = 0;
        for (Slot slot : slots) {
            if (slot.inUse) count++;
        }
        return count;
    }

    /**
     * Closes every session and the factory. Later calls do nothing.
     */
    public void teardownAll() {
        List<Slot> toClose;
        synchronized (this) {
            if (closed) return;
            closed = true;
            toClose = new ArrayList<>(slots);
            slots.clear();
        }
        log.info("Tearing down {} renderer sessions", toClose.size());
        for (Slot slot : toClose) {
            closeQuietly(slot.session);
        }
        try {
            factory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing session factory", e);
        }
    }

    @Override
    public void close() {
        teardownAll();
    }

    private static void closeQuietly(RendererSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Error closing renderer session {}", session.id(), e);
        }
    }
}
