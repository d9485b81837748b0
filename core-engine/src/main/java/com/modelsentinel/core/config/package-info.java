/**
 * Engine settings and YAML loading of per-model monitoring configuration.
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.config;
