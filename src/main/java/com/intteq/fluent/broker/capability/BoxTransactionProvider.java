package com.intteq.fluent.broker.capability;

/**
 * Supplies the ambient transaction an outbox write joins.
 */
public interface BoxTransactionProvider {

    Object currentTransaction();

    boolean hasOpenTransaction();
}
