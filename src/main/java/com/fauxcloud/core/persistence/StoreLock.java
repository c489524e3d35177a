package com.fauxcloud.core.persistence;

/**
 * Exclusive claim on an {@link InstanceStore}, held by the one manager allowed to write to it.
 */
public interface StoreLock extends AutoCloseable {

    @Override
    void close();
}
