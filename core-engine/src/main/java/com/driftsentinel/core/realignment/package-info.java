/**
 * Suggestion generation for detected drift, with a rule-based baseline that
 * never depends on the optional enricher.
 */
package com.driftsentinel.core.realignment;
