package com.lumina.agent.llm;

import com.lumina.agent.core.CancellationToken;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Request factory that ties each outgoing request to the cancellation token bound
 * on the current thread, so cancelling a task aborts the socket exchange instead
 * of leaving it to run until the response timeout.
 *
 * Usage: wrap the RestClient exchange in {@link #withCancellation}.
 */
public class CancellableRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private static final ThreadLocal<Scope> CURRENT = new ThreadLocal<>();

    public CancellableRequestFactory(HttpClient httpClient) {
        super(httpClient);
    }

    /**
     * Runs {@code exchange} with {@code token} bound to this thread. Requests created
     * meanwhile are cancelled when the token is; the registrations are dropped on return.
     */
    public static <T> T withCancellation(CancellationToken token, Supplier<T> exchange) {
        if (token == null) {
            return exchange.get();
        }
        Scope previous = CURRENT.get();
        Scope scope = new Scope(token);
        CURRENT.set(scope);
        try {
            return exchange.get();
        } finally {
            scope.close();
            if (previous != null) {
                CURRENT.set(previous);
            } else {
                CURRENT.remove();
            }
        }
    }

    @Override
    protected void postProcessHttpRequest(ClassicHttpRequest request) {
        Scope scope = CURRENT.get();
        if (scope != null && request instanceof Cancellable) {
            scope.register((Cancellable) request);
        }
    }

    private static final class Scope {

        private final CancellationToken token;
        private final List<Runnable> registrations = new ArrayList<>();

        Scope(CancellationToken token) {
            this.token = token;
        }

        void register(Cancellable request) {
            registrations.add(token.onCancel(request::cancel));
        }

        void close() {
            registrations.forEach(Runnable::run);
            registrations.clear();
        }
    }
}
