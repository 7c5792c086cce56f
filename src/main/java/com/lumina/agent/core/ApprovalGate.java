package com.lumina.agent.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Single-shot rendezvous between the loop and a human decision.
 * The first resolution wins; later ones are ignored.
 */
public class ApprovalGate {

    private final CompletableFuture<Boolean> decision = new CompletableFuture<>();

    /** Returns false if the gate had already been resolved. */
    public boolean resolve(boolean approved) {
        return decision.complete(approved);
    }

    public boolean isResolved() {
        return decision.isDone();
    }

    public boolean await() throws InterruptedException {
        try {
            return decision.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Approval gate completed exceptionally", e.getCause());
        }
    }
}
