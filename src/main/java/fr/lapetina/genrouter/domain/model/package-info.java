/**
 * Domain model of the generation router.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.genrouter.domain.model.GenerationRequest} - Immutable request to route</li>
 *   <li>{@link fr.lapetina.genrouter.domain.model.ProviderDescriptor} - Catalog entry for a provider</li>
 *   <li>{@link fr.lapetina.genrouter.domain.model.TierPolicy} - Allowances and usage assumptions of a tier</li>
 *   <li>{@link fr.lapetina.genrouter.domain.model.HealthState} - Circuit-breaker snapshot, replaced by CAS</li>
 *   <li>{@link fr.lapetina.genrouter.domain.model.AttemptRecord} - One provider attempt, for metrics</li>
 *   <li>{@link fr.lapetina.genrouter.domain.model.OrchestrationResult} - Success or terminal failure</li>
 * </ul>
 *
 * <p>Everything here is immutable. Money is {@link java.math.BigDecimal}.
 */
package fr.lapetina.genrouter.domain.model;
