/**
 * Alert persistence.
 */
package com.driftsentinel.core.alerting.store;
