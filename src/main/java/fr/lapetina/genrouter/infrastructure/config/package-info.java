/**
 * YAML configuration: JavaBean binding, validation, hot reload, and mapping to registry entries.
 */
package fr.lapetina.genrouter.infrastructure.config;
