package com.glimpse.core.ops;

/**
 * User-facing error channel. Called from the worker thread; implementations hand the message to
 * their own thread.
 */
@FunctionalInterface
public interface ErrorSink {
    void report(String message);
}
