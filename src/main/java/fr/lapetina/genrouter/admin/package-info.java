/**
 * Operator-facing view of the router: health, metrics, cost projections and spend.
 */
package fr.lapetina.genrouter.admin;
