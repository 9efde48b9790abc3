/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.watchman.infrastructure.config.WatchmanConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.watchman.infrastructure.config.ConfigLoader} - YAML loading, overrides and file watching</li>
 *   <li>{@link fr.lapetina.watchman.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog, threads)</li>
 *   <li>{@code project} - Project name and version reported by the listing endpoint</li>
 *   <li>{@code targets} - Deployment targets registered at startup</li>
 *   <li>{@code polling} - Round interval, probe timeout, round deadline, concurrency, failure threshold</li>
 *   <li>{@code pipeline} - Ring buffer and wait strategy settings</li>
 *   <li>{@code http} - Probe client connect timeout</li>
 *   <li>{@code metrics} - Prometheus metric prefix</li>
 * </ul>
 *
 * <p>{@code watchman.server.port} and {@code watchman.polling.*} system properties override
 * the file at load time.
 */
package fr.lapetina.watchman.infrastructure.config;
