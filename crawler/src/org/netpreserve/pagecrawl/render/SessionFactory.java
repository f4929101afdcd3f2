package org.netpreserve.pagecrawl.render;

public interface SessionFactory extends AutoCloseable {
    /**
     * @param isolated open the session in the shared isolated context rather than the default one
     */
    RendererSession create(boolean isolated) throws RenderException;

    /**
     * Disposes the isolated context and anything else the factory owns.
     */
    @Override
    void close();
}
