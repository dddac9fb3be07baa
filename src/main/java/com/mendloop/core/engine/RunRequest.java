package com.mendloop.core.engine;

import com.mendloop.core.model.LoopPhase;

import java.nio.file.Path;

/**
 * What the CLI asks the engine to do.
 *
 * @param manifest      task manifest to load
 * @param resume        continue from {@code checkpoint.json}
 * @param fromPhase     explicit phase to (re-)enter at, {@code null} for the default
 * @param iteration     iteration to enter at, {@code null} for the default
 * @param maxIterations ceiling override, {@code null} to use configuration or the checkpoint
 */
public record RunRequest(
    Path manifest,
    boolean resume,
    LoopPhase fromPhase,
    Integer iteration,
    Integer maxIterations
) {

    public static RunRequest fresh(Path manifest) {
        return new RunRequest(manifest, false, null, null, null);
    }
}
