/**
 * Server selection strategies.
 *
 * <p>{@link fr.lapetina.gamelb.domain.strategy.RoundRobinSelector} hands out pool indices
 * in strict cyclic order. Concurrent callers may see interleaved sequences, but the shared
 * cursor advances exactly once per call.
 *
 * @see fr.lapetina.gamelb.domain.strategy.ServerSelector
 */
package fr.lapetina.gamelb.domain.strategy;
