/**
 * Error taxonomy. Only {@link com.driftsentinel.core.error.ConfigException} is
 * fatal; every other failure is contained by the component that raised it.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.error;
