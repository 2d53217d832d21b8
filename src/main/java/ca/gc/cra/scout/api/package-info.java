/**
 * Command-line entry points.
 *
 * <p>{@link ca.gc.cra.scout.api.Main} dispatches to {@code collect} and {@code deployments}.
 * Arguments are {@code key=value} pairs plus a few flags; values merge over an optional YAML file
 * and built-in defaults before validation.</p>
 */
package ca.gc.cra.scout.api;
