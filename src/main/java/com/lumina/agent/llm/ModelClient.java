package com.lumina.agent.llm;

import com.lumina.agent.model.Message;

import java.util.List;
import java.util.function.Consumer;

public interface ModelClient {

    /**
     * Send the full conversation to the model and block until it answers.
     *
     * @param messages full history (system prompt first)
     * @param options  cancellation token, sampling and per-task overrides
     * @return the raw reply text plus usage when the provider reports it
     * @throws com.lumina.agent.exception.ModelTransportException when the provider cannot be reached
     *         or answers with an error
     */
    ModelReply call(List<Message> messages, ModelCallOptions options);

    /**
     * Streaming variant. Providers without streaming support answer in one
     * TEXT chunk followed by a USAGE chunk when usage is known.
     */
    default void stream(List<Message> messages, ModelCallOptions options, Consumer<StreamChunk> sink) {
        ModelReply reply = call(messages, options);
        sink.accept(StreamChunk.text(reply.getContent()));
        if (reply.getUsage() != null) {
            sink.accept(StreamChunk.usage(reply.getUsage()));
        }
    }
}
