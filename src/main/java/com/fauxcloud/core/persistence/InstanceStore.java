package com.fauxcloud.core.persistence;

import com.fauxcloud.core.model.Instance;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of instance state. The lifecycle manager writes through on every transition and
 * reloads the full set at start-up.
 */
public interface InstanceStore {

    void put(Instance instance);

    Optional<Instance> get(String id);

    void delete(String id);

    List<Instance> list();

    /**
     * Claims the store for the calling manager until the returned lock is closed.
     *
     * @throws StoreLockedException if the store is already claimed
     */
    StoreLock claim();
}
