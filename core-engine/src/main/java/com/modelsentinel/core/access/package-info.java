/**
 * Role-based access control in front of the engine's alert operations.
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.access;
