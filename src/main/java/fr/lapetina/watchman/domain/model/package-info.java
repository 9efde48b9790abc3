/**
 * Domain model classes for fleet health reconciliation.
 *
 * <p>Every class in this package is immutable and safe to share between the
 * poller thread, the reconciliation thread and HTTP handler threads.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.watchman.domain.model.DeploymentTarget} - A model deployment that should exist</li>
 *   <li>{@link fr.lapetina.watchman.domain.model.ProbeResult} - Outcome of one health check</li>
 *   <li>{@link fr.lapetina.watchman.domain.model.ProbeOutcome} - Closed set of probe outcomes</li>
 *   <li>{@link fr.lapetina.watchman.domain.model.StatusEntry} - Authoritative per-target state</li>
 *   <li>{@link fr.lapetina.watchman.domain.model.TargetHealth} - HEALTHY / UNHEALTHY classification</li>
 * </ul>
 *
 * @see fr.lapetina.watchman.domain.reconcile.StateReconciler
 */
package fr.lapetina.watchman.domain.model;
