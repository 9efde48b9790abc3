/**
 * LMAX Disruptor-based pipeline for reconciling closed probe rounds.
 *
 * <p>The poller is the single producer. Rounds are consumed in publication order by one
 * handler chain, so the status table has exactly one writer.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Reconcile → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.watchman.disruptor.RoundPipeline} - Pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.watchman.disruptor.exception.BackpressureException} - Thrown when a round
 *       cannot be published</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.watchman.disruptor;
