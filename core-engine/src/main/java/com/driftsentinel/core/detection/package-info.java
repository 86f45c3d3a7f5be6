/**
 * Drift classification: {@link com.driftsentinel.core.detection.DriftDetector}
 * compares observed signatures with a
 * {@link com.driftsentinel.core.model.Specification}, resolved per path by a
 * {@link com.driftsentinel.core.detection.SpecificationProvider}.
 */
package com.driftsentinel.core.detection;
