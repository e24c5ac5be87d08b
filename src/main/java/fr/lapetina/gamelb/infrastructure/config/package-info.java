/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into
 * {@link fr.lapetina.gamelb.infrastructure.config.SimulationConfig}. The server pool is fixed
 * for the lifetime of a simulation, so configuration is read once at start-up.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code servers} - pool size and server naming</li>
 *   <li>{@code simulation} - player count, concurrency limit, arrival interval, timeout, time scale</li>
 *   <li>{@code processingTime} - simulated delay distribution and bounds</li>
 *   <li>{@code disruptor} - ring buffer and wait strategy settings</li>
 *   <li>{@code sink} - bounded wait for metrics appends</li>
 *   <li>{@code output} - CSV, JSON and Prometheus output files</li>
 *   <li>{@code metrics} - Micrometer meter name prefix</li>
 * </ul>
 *
 * @see fr.lapetina.gamelb.infrastructure.config.ConfigLoader
 */
package fr.lapetina.gamelb.infrastructure.config;
