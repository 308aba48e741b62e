package com.devportal.health;

import java.util.concurrent.CancellationException;

/**
 * Completes an in-flight probe whose {@link CancellationToken} was cancelled.
 */
public class ProbeCancelledException extends CancellationException {

    public ProbeCancelledException(String url) {
        super("Probe cancelled: " + url);
    }
}
