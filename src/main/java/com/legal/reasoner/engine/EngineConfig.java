package com.legal.reasoner.engine;

/**
 * Tuning knobs of a {@link FixedPointEngine}. None of them changes the result
 * of a run, only how it is computed and how much of it is kept.
 *
 * @param parallelism       number of worker threads evaluating rules within a
 *                          step; 1 evaluates on the calling thread.
 * @param retainSnapshots   keep the full fact assignment of every timestep.
 * @param recordDerivations append a derivation record for every changed fact.
 */
public record EngineConfig(int parallelism, boolean retainSnapshots, boolean recordDerivations) {

    public static final EngineConfig DEFAULT = new EngineConfig(1, false, true);

    public EngineConfig {
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
    }

    public EngineConfig withParallelism(int n) {
        return new EngineConfig(n, retainSnapshots, recordDerivations);
    }

    public EngineConfig withRetainSnapshots(boolean retain) {
        return new EngineConfig(parallelism, retain, recordDerivations);
    }

    public EngineConfig withRecordDerivations(boolean record) {
        return new EngineConfig(parallelism, retainSnapshots, record);
    }
}
