/**
 * LMAX Disruptor submission pipeline in front of the orchestrator.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Admission → Dispatch → Metrics → Completion
 * </pre>
 *
 * <p>Rejections by the pipeline complete the caller's future with a terminal result;
 * only a full ring buffer surfaces as a
 * {@link fr.lapetina.genrouter.disruptor.exception.BackpressureException}.
 *
 * @see fr.lapetina.genrouter.disruptor.GenerationPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.genrouter.disruptor;
