package com.pgokache.service;

import com.pgokache.model.Instance;

import java.sql.Connection;

/**
 * Opens database connections to monitored instances.
 */
public interface ConnectionFactory {

    /**
     * Opens a connection with auto-commit disabled. The caller closes it.
     *
     * @param instance connection coordinates
     * @param password decrypted password
     * @return open connection
     * @throws InstanceConnectionException if the instance cannot be reached or rejects the login
     */
    Connection open(Instance instance, String password);

    /**
     * Releases any resources held for an instance, e.g. after its coordinates changed or it was deleted.
     *
     * @param instanceId instance id
     */
    void evict(long instanceId);
}
