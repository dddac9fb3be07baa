package com.mendloop.worker;

/**
 * A launched worker, as seen by the pool. Each instance owns exactly one child process.
 */
public interface WorkerProcess {

    /** True while the process has not exited. Must not block. */
    boolean isAlive();

    /** Exit code; only meaningful once {@link #isAlive()} returned false. */
    int exitCode();

    /** Output captured so far (may be truncated). */
    String output();

    /** Forcibly terminates the process and its descendants. */
    void destroy();

    /** Releases resources held for the job (payload file, streams). Called once, after collection. */
    default void release() {
    }
}
