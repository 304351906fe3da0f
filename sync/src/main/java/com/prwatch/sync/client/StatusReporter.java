package com.prwatch.sync.client;

/**
 * Receives human-readable progress text while a request is in flight,
 * e.g. the remaining seconds of a rate-limit wait.
 */
@FunctionalInterface
public interface StatusReporter {

    void report(String text);
}
