package org.netpreserve.pagecrawl.render;

import org.netpreserve.pagecrawl.PageMetadata;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * Session whose probes return scripted counter values.
 */
class FakeSession implements RendererSession {
    private final String id;
    IntSupplier resources = () -> 3;
    IntSupplier mutations = () -> 10;
    IntSupplier contentLength = () -> 500;
    boolean selectorsPresent = true;
    boolean failProbes;
    boolean failThrottling;
    volatile boolean alive = true;
    final AtomicInteger throttlingCalls = new AtomicInteger();
    final AtomicInteger loads = new AtomicInteger();
    volatile boolean closed;
    String loadedUrl;

    FakeSession(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void disableThrottling() throws RenderException {
        throttlingCalls.incrementAndGet();
        if (failThrottling) throw new RenderException("Target closed before debugger attached");
    }

    @Override
    public void load(String url, Duration timeout) throws RenderException, InterruptedException {
        loads.incrementAndGet();
        loadedUrl = url;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T runProbe(Probe<T> probe) throws RenderException {
        if (failProbes) throw new RenderException("Execution context was destroyed");
        return switch (probe.name()) {
            case "resources" -> (T) Integer.valueOf(resources.getAsInt());
            case "mutations" -> (T) Integer.valueOf(mutations.getAsInt());
            case "content-length" -> (T) Integer.valueOf(contentLength.getAsInt());
            case "selectors" -> (T) Boolean.valueOf(selectorsPresent);
            default -> throw new RenderException("Unknown probe " + probe.name());
        };
    }

    @Override
    public RenderedPage extract() {
        return new RenderedPage(loadedUrl, "<html><body>Hello</body></html>", "Hello", List.of(),
                PageMetadata.EMPTY, null);
    }

    @Override
    public void close() {
        closed = true;
        alive = false;
    }
}
