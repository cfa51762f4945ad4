/**
 * Provider health: one three-state circuit breaker per provider.
 *
 * <p>CLOSED counts consecutive failures and trips to OPEN at the threshold. OPEN
 * excludes the provider until its cooldown ends, after which exactly one request
 * may hold the HALF_OPEN trial slot. Cooldowns grow geometrically with each trip.
 */
package fr.lapetina.genrouter.infrastructure.health;
