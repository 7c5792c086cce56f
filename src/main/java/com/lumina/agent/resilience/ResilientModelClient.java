package com.lumina.agent.resilience;

import com.lumina.agent.llm.ModelCallOptions;
import com.lumina.agent.llm.ModelClient;
import com.lumina.agent.llm.ModelReply;
import com.lumina.agent.llm.StreamChunk;
import com.lumina.agent.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Decorator around the provider client that adds a circuit breaker.
 *
 * There is deliberately no @Retry here: the agent loop owns retries through its
 * consecutive-error budget and tells the model about each failure. When the
 * circuit is open the call fails fast with CallNotPermittedException, which the
 * loop counts like any other transport failure.
 *
 * Circuit breaker config (application.yml, instance "modelClient"):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientModelClient implements ModelClient {

    private final ModelClient delegate;

    public ResilientModelClient(@Qualifier("providerModelClient") ModelClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "modelClient")
    public ModelReply call(List<Message> messages, ModelCallOptions options) {
        return delegate.call(messages, options);
    }

    @Override
    @CircuitBreaker(name = "modelClient")
    public void stream(List<Message> messages, ModelCallOptions options, Consumer<StreamChunk> sink) {
        delegate.stream(messages, options, sink);
    }
}
