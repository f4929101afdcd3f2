package org.netpreserve.pagecrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.pagecrawl.cdp.protocol.Unwrap;

import java.util.Objects;
import java.util.function.Consumer;

public interface Page {
    Navigate navigate(String url);

    void close();

    void enable();

    void onLifecycleEvent(Consumer<LifecycleEvent> handler);

    @Unwrap("identifier")
    ScriptIdentifier addScriptToEvaluateOnNewDocument(String source, String worldName);

    void setLifecycleEventsEnabled(boolean enabled);

    /**
     * @param state "frozen" or "active"
     */
    void setWebLifecycleState(String state);

    record LifecycleEvent(FrameId frameId, Network.LoaderId loaderId, String name, Network.MonotonicTime timestamp) {
    }

    record ScriptIdentifier(@JsonValue String value) {
        @JsonCreator
        public ScriptIdentifier {
            Objects.requireNonNull(value);
        }
    }

    record FrameId(@JsonValue String value) {
        @JsonCreator
        public FrameId {
            Objects.requireNonNull(value);
        }
    }

    record Navigate(FrameId frameId, Network.LoaderId loaderId, String errorText) {
    }
}
