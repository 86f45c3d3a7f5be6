/**
 * Drift Sentinel daemon: environment-driven process configuration, a
 * file-system change source, the signature snapshot reader and the HTTP
 * health/status server.
 */
package com.driftsentinel.daemon;
