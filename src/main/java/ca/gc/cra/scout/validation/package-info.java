/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p><strong>Role:</strong> Reject malformed names, durations and output paths before any cluster
 * call is made.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.scout.validation;
