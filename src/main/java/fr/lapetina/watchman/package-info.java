/**
 * Watchman - fleet health reconciliation for model deployments.
 *
 * <p>Watchman keeps a registry of deployment targets, probes every target once per round
 * and folds each closed round into a status table that the HTTP API serves.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.watchman.WatchmanFactory} - Wires registry, poller, pipeline and
 *       status store from YAML configuration</li>
 *   <li>{@link fr.lapetina.watchman.WatchmanApplication} - Standalone HTTP server exposing
 *       status and target registration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (WatchmanFactory factory = WatchmanFactory.create("watchman.yaml").start()) {
 *     for (StatusEntry entry : factory.getStatusStore().list()) {
 *         System.out.println(entry.name() + " " + entry.health());
 *     }
 * }
 * }</pre>
 *
 * @see fr.lapetina.watchman.WatchmanFactory
 * @see fr.lapetina.watchman.disruptor.RoundPipeline
 */
package fr.lapetina.watchman;
