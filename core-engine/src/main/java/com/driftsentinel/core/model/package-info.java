/**
 * Domain model classes for Drift Sentinel.
 *
 * <p>
 * This package contains the value objects shared between the monitor, the
 * drift detector, the alert system and the realignment engine:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.model.Specification} and
 * {@link com.driftsentinel.core.model.ExpectedElement}: what the code should
 * provide</li>
 * <li>{@link com.driftsentinel.core.model.SignatureSet}: what the code
 * currently provides</li>
 * <li>{@link com.driftsentinel.core.model.DriftReport}: immutable comparison
 * result</li>
 * <li>{@link com.driftsentinel.core.model.Alert}: persisted notification</li>
 * <li>{@link com.driftsentinel.core.model.Suggestion}: ranked corrective
 * action</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
