/**
 * Log tail adapters: local filesystem access and in-pod access through exec.
 */
package ca.gc.cra.scout.infrastructure.logtail;
