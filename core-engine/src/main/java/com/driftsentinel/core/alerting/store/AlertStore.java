package com.driftsentinel.core.alerting.store;

import com.driftsentinel.core.error.StoreException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;

import java.util.List;
import java.util.Optional;

/**
 * Key-ordered alert storage with lookups by open fingerprint and by
 * (resolved, severity).
 *
 * <p>
 * Callers serialise writes; implementations only need to keep individual
 * calls consistent. Returned alerts are the stored instances, so callers must
 * copy before handing them out.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * Insert or update an alert and refresh the secondary indices.
     *
     * @param alert alert to store
     */
    void save(Alert alert);

    Optional<Alert> findById(String id);

    /**
     * @param fingerprint alert fingerprint
     * @return the unresolved alert with this fingerprint, if any
     */
    Optional<Alert> findOpenByFingerprint(String fingerprint);

    /**
     * @param resolved    resolved flag to match
     * @param minSeverity lowest severity to include
     * @return matching alerts ordered by id
     */
    List<Alert> findByStatus(boolean resolved, AlertSeverity minSeverity);

    /**
     * @return every alert ordered by id
     */
    List<Alert> findAll();

    int size();

    /**
     * Persist pending changes.
     *
     * @throws StoreException if the backing storage cannot be written
     */
    void flush();
}
