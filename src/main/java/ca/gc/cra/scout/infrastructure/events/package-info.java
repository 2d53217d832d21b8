/**
 * Event sinks attached to the error aggregator.
 */
package ca.gc.cra.scout.infrastructure.events;
