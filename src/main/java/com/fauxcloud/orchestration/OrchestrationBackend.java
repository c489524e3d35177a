package com.fauxcloud.orchestration;

import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceCredentials;
import com.fauxcloud.core.model.InstanceStatus;

/**
 * Drives the container runtime on behalf of the lifecycle manager.
 * Implementations hold no per-instance state beyond port reservations and on-disk artefacts;
 * each operation takes an instance snapshot and returns the updated snapshot.
 * Implementations: ComposeOrchestrationBackend (docker compose + Docker Engine API).
 */
public interface OrchestrationBackend {

    /**
     * Allocates ports, renders the deployment for the instance's topology and writes it to the
     * instance directory. On failure nothing stays reserved or written.
     *
     * @return the instance with endpoints, network, volumes and allocated ports filled in
     */
    ProvisionResult provision(Instance instance, InstanceCredentials credentials);

    /**
     * Brings the rendered deployment up. A runtime failure is returned as {@code ERROR}
     * with the runtime's diagnostics rather than thrown.
     */
    Instance start(Instance instance);

    /**
     * Brings the deployment down, keeping volumes.
     */
    Instance stop(Instance instance);

    /**
     * Removes containers, volumes and the instance directory, and releases the instance's ports
     * when at least one cleanup step succeeded.
     */
    DestroyReport destroy(Instance instance);

    /**
     * Point-in-time verdict from inspecting the instance's containers.
     */
    InstanceStatus health(Instance instance);

    /**
     * Recent log output of each container, optionally filtered by a container name substring.
     */
    String logs(Instance instance, String component, int tail);
}
