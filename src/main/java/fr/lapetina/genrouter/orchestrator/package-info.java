/**
 * Request orchestration: candidate selection, sequential failover, cancellation and deduplication.
 */
package fr.lapetina.genrouter.orchestrator;
