/**
 * Session report persistence using the jackson-core streaming generator.
 */
package ca.gc.cra.scout.infrastructure.report;
