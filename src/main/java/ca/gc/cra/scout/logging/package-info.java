/**
 * Logging helpers: runtime level control for the CLI and truncation of untrusted text before it
 * reaches operator logs.
 */
package ca.gc.cra.scout.logging;
