/**
 * Named executors for session tasks and the aggregator consumer.
 */
package ca.gc.cra.scout.infrastructure.exec;
