package org.sandpile.runtime.spi;

/**
 * Provides deterministic randomness scoped to a simulation run.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams, so that
 * grid initialization and grain drops do not share one sequence.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns the seed this provider was created from.
     *
     * @return the seed
     */
    long getSeed();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     *
     * @param scope a stable, descriptive scope name (e.g., "grid-init", "drops")
     * @param key a stable numeric key
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
