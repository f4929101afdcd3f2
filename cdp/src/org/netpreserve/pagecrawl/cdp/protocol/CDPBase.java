package org.netpreserve.pagecrawl.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.core.util.Separators.Spacing;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static org.netpreserve.pagecrawl.util.LogUtils.ellipses;

/**
 * Common machinery for the browser-level client and per-target sessions.
 * <p>
 * Domains are exposed as dynamic proxies over plain interfaces (see {@link #domain(Class)}). A method named
 * {@code onSomething} taking a single {@link Consumer} registers an event listener, any other method sends a command
 * named {@code Domain.method} with the Java parameter names as the JSON parameter names. Null arguments are omitted.
 * Commands block for up to {@link #COMMAND_TIMEOUT_SECONDS} unless the method returns a {@link CompletionStage}.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    static final long COMMAND_TIMEOUT_SECONDS = 120;
    private static final ObjectWriter logJson = RPC.JSON.copy()
            .writer().without(JsonWriteFeature.QUOTE_FIELD_NAMES)
            .with(new DefaultPrettyPrinter()
                    .withArrayIndenter(null)
                    .withObjectIndenter(null)
                    .withSeparators(new Separators()
                            .withObjectEntrySpacing(Spacing.AFTER)
                            .withObjectFieldValueSpacing(Spacing.AFTER)));
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final Map<String, Consumer<JsonNode>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService eventExecutor;
    private volatile Thread eventThread;

    protected CDPBase() {
        String ownerName = Thread.currentThread().getName();
        eventExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, ownerName + "-CDP");
            thread.setDaemon(true);
            eventThread = thread;
            return thread;
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> T domain(Class<T> domainInterface) {
        return (T) Proxy.newProxyInstance(getClass().getClassLoader(), new Class[]{domainInterface},
                (proxy, method, args) -> {
                    if (method.getName().equals("toString")) {
                        return domainInterface.getSimpleName() + "@" + System.identityHashCode(proxy);
                    }
                    var parameters = method.getParameters();
                    if (method.getName().startsWith("on") && parameters.length == 1
                        && parameters[0].getType() == Consumer.class) {
                        var consumerType = (ParameterizedType) method.getGenericParameterTypes()[0];
                        addListener((Class<?>) consumerType.getActualTypeArguments()[0], (Consumer) args[0]);
                        return null;
                    }
                    var params = new HashMap<String, Object>(parameters.length);
                    for (int i = 0; i < parameters.length; i++) {
                        if (args[i] != null) params.put(parameters[i].getName(), args[i]);
                    }
                    return sendCommand(domainInterface.getSimpleName() + "." + method.getName(), params,
                            method.getGenericReturnType(), method.getAnnotation(Unwrap.class));
                });
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            eventExecutor.submit(() -> {
                if (message instanceof RPC.Event event) {
                    dispatchEvent(event);
                } else if (message instanceof RPC.Response response) {
                    completeCommand(response);
                } else {
                    log.error("Unknown message type: {}", message);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dropping message, session is closing", e);
        }
    }

    private void completeCommand(RPC.Response response) {
        var future = pending.remove(response.id());
        if (future == null) {
            log.warn("Received response to unknown call id {}", response.id());
        } else if (response.error() == null) {
            future.complete(response.result());
        } else {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        }
    }

    private void dispatchEvent(RPC.Event event) {
        if (log.isTraceEnabled()) {
            log.trace("{}{}", event.method(), ellipses(toLogJson(event.params())));
        }
        Consumer<JsonNode> listener = listeners.get(event.method());
        if (listener == null) return;
        try {
            listener.accept(event.params());
        } catch (Exception e) {
            log.error("{} listener threw", event.method(), e);
        }
    }

    private static String eventName(Class<?> eventClass) {
        return eventClass.getEnclosingClass().getSimpleName() + "." + lowercaseFirstLetter(eventClass.getSimpleName());
    }

    public <T> void addListener(Class<T> eventClass, Consumer<T> callback) {
        listeners.put(eventName(eventClass), params -> {
            try {
                callback.accept(RPC.JSON.treeToValue(params, eventClass));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private static boolean isCompletionStage(Type type) {
        return type instanceof ParameterizedType parameterizedType
               && CompletionStage.class.isAssignableFrom((Class<?>) parameterizedType.getRawType());
    }

    Object sendCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        boolean async = isCompletionStage(returnType);
        if (!async && Thread.currentThread() == eventThread) {
            throw new IllegalStateException("Sending a blocking command from the event thread would deadlock");
        }
        if (method.endsWith("Async")) {
            method = method.substring(0, method.length() - "Async".length());
        }
        Type valueType = async ? ((ParameterizedType) returnType).getActualTypeArguments()[0] : returnType;

        long commandId = nextCommandId();
        if (log.isTraceEnabled()) {
            log.trace("[{}] {}{}", commandId, method, ellipses(toLogJson(params)));
        }

        boolean keepPending = false;
        try {
            var future = new CompletableFuture<JsonNode>();
            if (log.isTraceEnabled()) {
                future.whenComplete((result, ex) -> log.trace("[{}] {}", commandId,
                        ex == null ? ellipses(toLogJson(result)) : ex.getMessage()));
            }
            pending.put(commandId, future);
            sendCommandMessage(commandId, method, params);

            CompletableFuture<?> mapped = future.thenApply(result -> readResult(result, valueType, unwrap));
            if (async) {
                keepPending = true;
                return mapped;
            }
            return mapped.get(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else {
                throw new RuntimeException(e.getCause());
            }
        } catch (TimeoutException e) {
            throw new CDPTimeoutException("Timed out waiting for " + method);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPTimeoutException("Interrupted waiting for " + method);
        } finally {
            if (!keepPending) pending.remove(commandId);
        }
    }

    private static Object readResult(JsonNode result, Type valueType, Unwrap unwrap) {
        ObjectReader reader = RPC.JSON.reader();
        if (unwrap != null) {
            String field = unwrap.value().isEmpty() ?
                    lowercaseFirstLetter(((Class<?>) valueType).getSimpleName()) : unwrap.value();
            reader = reader.with(DeserializationFeature.UNWRAP_ROOT_VALUE).withRootName(field);
        }
        try {
            return reader.treeToValue(result, RPC.JSON.constructType(valueType));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String toLogJson(Object value) {
        try {
            return logJson.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String lowercaseFirstLetter(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException;

    protected abstract long nextCommandId();

    protected void close() {
        eventExecutor.shutdown();
    }

    /**
     * Fails every outstanding command once the underlying connection is gone.
     */
    protected void handleRpcClose() {
        pending.values().forEach(command -> command.completeExceptionally(new CDPClosedException()));
    }
}
