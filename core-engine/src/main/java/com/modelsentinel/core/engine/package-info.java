/**
 * The monitoring engine: metric submission, cooldown deduplication and the
 * alert operations exposed to request handlers.
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.engine;
