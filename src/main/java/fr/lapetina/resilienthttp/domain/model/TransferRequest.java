package fr.lapetina.resilienthttp.domain.model;

import fr.lapetina.resilienthttp.disruptor.BatchContext;
import fr.lapetina.resilienthttp.domain.body.EntityBody;
import fr.lapetina.resilienthttp.infrastructure.http.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An outgoing HTTP request and its lifecycle.
 *
 * Identity is an explicit id assigned at build time, never the object
 * reference. State moves {@code NEW -> TRANSFER -> COMPLETE|ERROR} and may be
 * reset to {@code NEW} for a resend; listeners see every transition.
 *
 * State, response and batch context are safe to read from any thread.
 */
public final class TransferRequest {

    private static final Logger log = LoggerFactory.getLogger(TransferRequest.class);

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final EntityBody body;
    private final Transport transport;

    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.NEW);
    private final List<RequestStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile TransferResponse response;
    private volatile Throwable failure;
    private volatile BatchContext batchContext;

    private TransferRequest(Builder builder) {
        this.id = SEQUENCE.incrementAndGet();
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Collections.unmodifiableMap(new TreeMap<>(builder.headers));
        this.body = builder.body;
        this.transport = builder.transport;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sends the request synchronously through its transport.
     *
     * Listeners run before this returns, so a synchronous retry triggered by
     * a failing response completes first and its final response is returned.
     *
     * @throws TransferException if the transport fails or a retry ends in error
     * @throws IllegalStateException if the request has no transport
     */
    public TransferResponse send() {
        if (transport == null) {
            throw new IllegalStateException("No transport configured: requestId=" + id);
        }
        setState(RequestState.TRANSFER);

        TransferResponse received;
        try {
            received = transport.send(this);
        } catch (IOException e) {
            fail(e);
            throw new TransferException(this, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
            throw new TransferException(this, e);
        }

        complete(received);

        if (state.get() == RequestState.ERROR) {
            throw new TransferException(this, failure);
        }
        return response;
    }

    /**
     * Attaches the response and moves to {@link RequestState#COMPLETE}.
     */
    public void complete(TransferResponse response) {
        this.response = Objects.requireNonNull(response, "response");
        this.failure = null;
        setState(RequestState.COMPLETE);
    }

    /**
     * Records a transport failure and moves to {@link RequestState#ERROR}.
     */
    public void fail(Throwable cause) {
        this.failure = cause;
        setState(RequestState.ERROR);
    }

    /**
     * Changes the state and notifies listeners when it actually changed.
     * A listener that throws is logged and does not stop the others.
     */
    public void setState(RequestState newState) {
        RequestState previous = state.getAndSet(Objects.requireNonNull(newState, "state"));
        if (previous == newState) {
            return;
        }
        log.debug("Request state changed: requestId={}, {} -> {}", id, previous, newState);
        for (RequestStateListener listener : listeners) {
            try {
                listener.onRequestStateChange(this);
            } catch (RuntimeException e) {
                log.error("Request state listener failed: requestId={}, state={}, listener={}",
                        id, newState, listener, e);
            }
        }
    }

    public void addListener(RequestStateListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(RequestStateListener listener) {
        listeners.remove(listener);
    }

    public long getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<EntityBody> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<Transport> getTransport() {
        return Optional.ofNullable(transport);
    }

    public RequestState getState() {
        return state.get();
    }

    /**
     * Returns the most recent response, or null before the first completion.
     */
    public TransferResponse getResponse() {
        return response;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<BatchContext> getBatchContext() {
        return Optional.ofNullable(batchContext);
    }

    /**
     * Binds the request to the batch it is being sent through, or clears the
     * binding with null.
     */
    public void setBatchContext(BatchContext batchContext) {
        this.batchContext = batchContext;
    }

    @Override
    public String toString() {
        return "TransferRequest{id=" + id + ", " + method + " " + uri + ", state=" + state.get() + "}";
    }

    /**
     * Builder for TransferRequest.
     */
    public static final class Builder {
        private String method = "GET";
        private URI uri;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private EntityBody body;
        private Transport transport;

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }

        public Builder uri(String uri) {
            return uri(URI.create(uri));
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        /**
         * Sets the body from any input accepted by {@link EntityBody#factory(Object)}.
         */
        public Builder body(Object body) {
            this.body = body == null ? null : EntityBody.factory(body);
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public TransferRequest build() {
            if (uri == null) {
                throw new IllegalStateException("Request URI is required");
            }
            return new TransferRequest(this);
        }
    }
}
