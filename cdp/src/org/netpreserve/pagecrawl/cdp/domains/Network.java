package org.netpreserve.pagecrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Only the shared identifier types are used; no Network commands are issued.
 */
public interface Network {
    record LoaderId(@JsonValue String value) {
        @JsonCreator
        public LoaderId {
            Objects.requireNonNull(value);
        }
    }

    record MonotonicTime(@JsonValue double value) {
        @JsonCreator
        public MonotonicTime {
        }
    }
}
