/**
 * Domain model: the fixed server pool, per-server counters and player requests.
 *
 * <p>All types are either immutable records or thread-safe through atomic references,
 * so they can be shared freely between dispatch workers.
 */
package fr.lapetina.gamelb.domain.model;
