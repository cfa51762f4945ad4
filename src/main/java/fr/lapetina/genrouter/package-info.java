/**
 * Tier-aware generation router.
 *
 * <p>Routes text and image generation requests across third-party providers: candidates
 * are chosen by subscription tier and price, attempted one after another until one
 * succeeds, and guarded by a per-provider circuit breaker. Every attempt is recorded for
 * metrics and actual spend; per-tier cost projections come from the same catalog.
 *
 * <p>{@link fr.lapetina.genrouter.RouterFactory} wires one instance of each component
 * from YAML configuration.
 */
package fr.lapetina.genrouter;
