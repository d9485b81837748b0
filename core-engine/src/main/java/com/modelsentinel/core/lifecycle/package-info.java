/**
 * Alert lifecycle state machine.
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.lifecycle;
