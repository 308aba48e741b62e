package com.devportal.health.model;

/**
 * Terminal status of a probe or a system information lookup.
 */
public enum ResultStatus {
    SUCCESS,
    ERROR
}
