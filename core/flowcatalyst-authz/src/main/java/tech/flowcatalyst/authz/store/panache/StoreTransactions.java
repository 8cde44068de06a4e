package tech.flowcatalyst.authz.store.panache;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.persistence.PersistenceException;
import tech.flowcatalyst.authz.store.GrantStoreUnavailableException;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs grant store work in a transaction and reports every failure, including
 * one raised while committing, as {@link GrantStoreUnavailableException}.
 *
 * Joins the caller's transaction when there is one; otherwise each call
 * commits on its own.
 */
final class StoreTransactions {

    private StoreTransactions() {}

    static <T> T call(String failureMessage, Callable<T> work) {
        return translate(failureMessage, () -> QuarkusTransaction.joiningExisting().call(work));
    }

    static void run(String failureMessage, Runnable work) {
        call(failureMessage, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Translate persistence and transaction failures of {@code transaction}.
     * Any other exception propagates unchanged.
     */
    static <T> T translate(String failureMessage, Supplier<T> transaction) {
        try {
            return transaction.get();
        } catch (PersistenceException | QuarkusTransactionException e) {
            throw new GrantStoreUnavailableException(failureMessage, e);
        }
    }
}
