package com.acme.render.core;

/**
 * A zero-argument call to an external dependency.
 */
@FunctionalInterface
public interface ProviderCall<T> {
    T call() throws Exception;
}
