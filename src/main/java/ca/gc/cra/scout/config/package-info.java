/**
 * Configuration loading and wiring.
 * <p><strong>Role:</strong> Merge embedded defaults, the YAML file and CLI overrides into one
 * validated {@link ca.gc.cra.scout.config.CollectConfig}, then build the object graph in
 * {@link ca.gc.cra.scout.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Used on the CLI thread during startup only.</p>
 */
package ca.gc.cra.scout.config;
