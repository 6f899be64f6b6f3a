package com.mediavault.service.ingest;

import java.nio.file.Path;

/**
 * Told about every filesystem mutation of a transaction before it is attempted.
 * An exception thrown here aborts the transaction before the mutation happens.
 */
@FunctionalInterface
public interface TransactionListener {

    TransactionListener NONE = (phase, from, to) -> { };

    /**
     * @param phase One of {@code stage}, {@code normalize}, {@code place}, {@code trash}, {@code restore}.
     */
    void beforeMutation(String phase, Path from, Path to);
}
