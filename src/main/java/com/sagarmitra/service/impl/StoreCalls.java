package com.sagarmitra.service.impl;

import com.sagarmitra.service.exception.ConversationPersistenceException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Runs blocking store operations on the bounded-elastic scheduler and reports any store
 * failure as a {@link ConversationPersistenceException}.
 */
final class StoreCalls {

    private StoreCalls() {
    }

    static <T> Mono<T> call(String action, Callable<T> operation) {
        return Mono.fromCallable(operation)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(ex -> !(ex instanceof ConversationPersistenceException),
                        ex -> new ConversationPersistenceException("Failed to " + action, ex));
    }

    static Mono<Void> run(String action, Runnable operation) {
        return call(action, () -> {
            operation.run();
            return Boolean.TRUE;
        }).then();
    }
}
