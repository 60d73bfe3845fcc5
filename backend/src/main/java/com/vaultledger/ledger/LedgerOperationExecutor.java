package com.vaultledger.ledger;

import com.vaultledger.config.AsyncConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Runs blocking ledger work off the event loop. Mutations go through the single ledger thread, one at a time
 * in submission order; reads use the shared bounded-elastic pool.
 */
@Component
public class LedgerOperationExecutor {

    private final Scheduler ledgerScheduler;

    public LedgerOperationExecutor(@Qualifier(AsyncConfig.LEDGER_EXECUTOR) Executor ledgerExecutor) {
        this.ledgerScheduler = Schedulers.fromExecutor(ledgerExecutor);
    }

    public <T> Mono<T> mutate(Callable<T> operation) {
        return Mono.fromCallable(operation).subscribeOn(ledgerScheduler);
    }

    public <T> Mono<T> read(Callable<T> query) {
        return Mono.fromCallable(query).subscribeOn(Schedulers.boundedElastic());
    }
}
