package com.devportal.health;

/**
 * Receives batch progress, once per component as it settles.
 * <p>
 * Calls are serialized: {@code completed} increases by one on every call, from 1 to
 * {@code total}. Which component settled is not reported, and completion order does not
 * follow input order.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int completed, int total);
}
