/**
 * Game Server Load Balancer - round-robin dispatch simulator for player connections.
 *
 * <p>Distributes synthetic player requests across a fixed pool of game servers, simulates a
 * processing delay for each one, and records per-request latency and per-server load.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gamelb.SimulationFactory} - Main entry point for creating
 *       a fully-wired simulation from YAML configuration</li>
 *   <li>{@link fr.lapetina.gamelb.GameLoadBalancerApplication} - Command line runner writing
 *       the CSV metrics, JSON report and Prometheus metrics</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SimulationFactory factory = SimulationFactory.create("simulation.yaml")) {
 *     SimulationSummary summary = factory.run();
 *     System.out.println(factory.report(summary).render());
 * }
 * }</pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Strict round-robin rotation; the cursor advances exactly once per request</li>
 *   <li>Per-server counters never lose an update and are read as a consistent pair</li>
 *   <li>Exactly one metrics record per successful dispatch, in completion order</li>
 *   <li>Bounded concurrency via a Disruptor worker pool</li>
 * </ul>
 *
 * @see fr.lapetina.gamelb.SimulationFactory
 * @see fr.lapetina.gamelb.simulation.SimulationDriver
 */
package fr.lapetina.gamelb;
