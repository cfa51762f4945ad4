/**
 * Provider adapters. The router only sees {@link fr.lapetina.genrouter.infrastructure.provider.ProviderAdapter};
 * wire formats stay behind it.
 */
package fr.lapetina.genrouter.infrastructure.provider;
