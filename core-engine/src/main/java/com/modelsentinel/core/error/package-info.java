/**
 * Typed failures surfaced by the monitoring engine.
 *
 * <p>
 * All failures extend {@link com.modelsentinel.core.error.MonitoringException}
 * and are unchecked. Cooldown suppression is not a failure; it is reported
 * as a successful outcome of metric submission.
 * </p>
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.error;
