package com.gentoro.contextmcp.store;

/** Work executed inside {@link StoreGateway#withTransaction}. */
@FunctionalInterface
public interface TransactionCallback<T> {
  T execute(StoreHandle handle);
}
