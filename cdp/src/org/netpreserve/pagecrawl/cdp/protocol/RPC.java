package org.netpreserve.pagecrawl.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.pagecrawl.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Message transport to the browser. Two flavours: a DevTools WebSocket and the null-delimited pipe used with
 * {@code --remote-debugging-pipe}.
 */
public interface RPC {
    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(300 * 1024 * 1024).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    void send(Command message) throws IOException;

    void close();

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final HttpClient httpClient = HttpClient.newHttpClient();
        private final WebSocket webSocket;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;

        public Socket(URI devtoolsUrl, Consumer<ServerMessage> messageHandler, Runnable closeHandler) throws IOException {
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            try {
                this.webSocket = httpClient.newWebSocketBuilder()
                        .buildAsync(devtoolsUrl, new Listener())
                        .get(10, TimeUnit.SECONDS);
            } catch (InterruptedException | ExecutionException | TimeoutException e) {
                throw new IOException("Failed to connect to " + devtoolsUrl, e);
            }
        }

        @Override
        public void send(Command message) throws JsonProcessingException {
            webSocket.sendText(JSON.writeValueAsString(message), true);
        }

        @Override
        public void close() {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "");
            webSocket.abort();
            closeHandler.run();
        }

        private class Listener implements WebSocket.Listener {
            private final StringBuilder buffer = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                buffer.append(data);
                if (last) {
                    String text = buffer.toString();
                    buffer.setLength(0);
                    try {
                        messageHandler.accept(JSON.readValue(text, ServerMessage.class));
                    } catch (IOException e) {
                        log.error("Failed to parse message: {}", LogUtils.ellipses(text), e);
                    }
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.debug("WebSocket closed: {} {}", statusCode, reason);
                closeHandler.run();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.warn("WebSocket error", error);
                closeHandler.run();
            }
        }
    }

    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private final InputStream inputStream;
        private final OutputStream outputStream;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final Lock writeLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();

        public Pipe(InputStream inputStream, OutputStream outputStream, Consumer<ServerMessage> messageHandler,
                    Runnable closeHandler) {
            this.inputStream = inputStream;
            this.outputStream = outputStream;
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            var thread = new Thread(this::readLoop, "CDP.Pipe");
            thread.setDaemon(true);
            thread.start();
        }

        private static int indexOfNull(byte[] buffer, int from, int to) {
            for (int i = from; i < to; i++) {
                if (buffer[i] == 0) return i;
            }
            return -1;
        }

        private void readLoop() {
            var partial = new ByteArrayOutputStream();
            byte[] buffer = new byte[256 * 1024];
            try {
                while (true) {
                    int n = inputStream.read(buffer);
                    if (n < 0) {
                        log.info("Browser closed the debugging pipe");
                        return;
                    }
                    int start = 0;
                    for (int end = indexOfNull(buffer, start, n); end >= 0; end = indexOfNull(buffer, start, n)) {
                        if (partial.size() == 0) {
                            dispatch(buffer, start, end - start);
                        } else {
                            partial.write(buffer, start, end - start);
                            byte[] message = partial.toByteArray();
                            partial.reset();
                            dispatch(message, 0, message.length);
                        }
                        start = end + 1;
                    }
                    partial.write(buffer, start, n - start);
                }
            } catch (IOException e) {
                if (!closed.get()) log.error("Error reading debugging pipe", e);
            } finally {
                close();
            }
        }

        private void dispatch(byte[] buffer, int offset, int length) throws IOException {
            if (log.isTraceEnabled()) {
                log.trace("<- {}", LogUtils.ellipses(new String(buffer, offset, length)));
            }
            messageHandler.accept(JSON.readValue(buffer, offset, length, ServerMessage.class));
        }

        @Override
        public void send(Command message) throws IOException {
            writeLock.lock();
            try {
                if (log.isTraceEnabled()) {
                    log.trace("-> {}", LogUtils.ellipses(JSON.writeValueAsString(message)));
                }
                JSON.writeValue(outputStream, message);
                outputStream.write(0);
                outputStream.flush();
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                outputStream.close();
            } catch (IOException e) {
                log.debug("Error closing pipe output", e);
            }
            try {
                inputStream.close();
            } catch (IOException e) {
                log.debug("Error closing pipe input", e);
            }
            closeHandler.run();
        }
    }
}
