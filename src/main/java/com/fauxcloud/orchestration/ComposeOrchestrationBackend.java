package com.fauxcloud.orchestration;

import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceCredentials;
import com.fauxcloud.core.model.InstanceStatus;
import com.fauxcloud.orchestration.allocation.PortAllocator;
import com.fauxcloud.orchestration.allocation.PortRole;
import com.fauxcloud.orchestration.topology.RenderContext;
import com.fauxcloud.orchestration.topology.RenderedDeployment;
import com.fauxcloud.orchestration.topology.TopologyRenderer;
import com.fauxcloud.orchestration.topology.TopologyStrategy;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Orchestration backend that materialises each instance as a compose project under
 * {@code <dataDir>/instances/<id>/}, drives it with the compose CLI, and inspects its containers
 * through the Docker Engine API.
 */
public class ComposeOrchestrationBackend implements OrchestrationBackend {

    private static final Logger log = LoggerFactory.getLogger(ComposeOrchestrationBackend.class);

    static final String COMPOSE_FILE = "docker-compose.yml";
    static final String DEFAULTS_DIR = "defaults";
    static final String DEFAULTS_FILE = "default.yml";

    private static final String HEALTHY = "healthy";
    private static final int LOG_TIMEOUT_SECONDS = 30;

    private final DockerClient dockerClient;
    private final ComposeCli compose;
    private final PortAllocator allocator;
    private final TopologyRenderer renderer;
    private final EndpointResolver endpointResolver;
    private final Path instancesDir;
    private final String networkPrefix;
    private final String imageRepository;
    private final SecureRandom random = new SecureRandom();

    public ComposeOrchestrationBackend(DockerClient dockerClient, ComposeCli compose, PortAllocator allocator,
                                       TopologyRenderer renderer, EndpointResolver endpointResolver,
                                       Path dataDir, String networkPrefix, String imageRepository) {
        this.dockerClient = dockerClient;
        this.compose = compose;
        this.allocator = allocator;
        this.renderer = renderer;
        this.endpointResolver = endpointResolver;
        this.instancesDir = dataDir.resolve("instances");
        this.networkPrefix = networkPrefix;
        this.imageRepository = imageRepository;
    }

    @Override
    public ProvisionResult provision(Instance instance, InstanceCredentials credentials) {
        var updated = instance.copy();
        TopologyStrategy strategy = renderer.strategyFor(instance.getConfig().topology());
        Map<PortRole, List<Integer>> ports = allocatePorts(strategy.rolePortCounts(instance.getConfig()));
        List<Integer> allPorts = ports.values().stream().flatMap(List::stream).toList();
        Path instanceDir = instanceDir(instance);

        try {
            String networkName = networkPrefix + "_" + instance.getId();
            var context = new RenderContext(
                    instance.getId(),
                    networkName,
                    imageRepository + ":" + instance.getConfig().productVersion(),
                    credentials.adminPassword(),
                    credentials.ingestionToken(),
                    HexFormat.of().formatHex(randomBytes(16)),
                    ports,
                    instance.getConfig(),
                    instanceDir.resolve(DEFAULTS_DIR).toAbsolutePath().toString(),
                    instance.getCreatedAt(),
                    instance.getExpiresAt());

            RenderedDeployment deployment = renderer.render(instance.getConfig().topology(), context);
            write(instanceDir, deployment);

            updated.setEndpoints(endpointResolver.resolve(
                    instance.getId(), deployment.descriptor(), instance.getConfig().adminApiEnabled()));
            updated.setNetworkId(networkName);
            updated.setVolumeIds(deployment.volumes());
            updated.setAllocatedPorts(allPorts);
            updated.transitionTo(InstanceStatus.PROVISIONING);
            log.info("Provisioned {} ({}) with ports {}", instance.getId(), instance.getConfig().topology(), allPorts);
            return new ProvisionResult(updated, credentials.adminPassword());
        } catch (RuntimeException e) {
            allocator.release(allPorts);
            deleteRecursively(instanceDir);
            throw e;
        }
    }

    @Override
    public Instance start(Instance instance) {
        var updated = instance.copy();
        Path composeFile = composeFile(instance);
        String project = TopologyRenderer.projectName(instance.getId());

        ProcessResult up = compose.up(composeFile, project);
        if (!up.succeeded()) {
            log.error("docker compose up failed for {}: {}", instance.getId(), up.diagnostics());
            updated.fail(up.diagnostics());
            return updated;
        }

        ProcessResult ps = compose.containerIds(composeFile, project);
        List<String> containerIds = ps.succeeded()
                ? Arrays.stream(ps.stdout().split("\\R")).map(String::strip).filter(s -> !s.isEmpty()).toList()
                : List.of();
        if (!ps.succeeded()) {
            log.warn("Could not list containers for {}: {}", instance.getId(), ps.diagnostics());
        }
        updated.setContainerIds(containerIds);
        updated.transitionTo(InstanceStatus.STARTING);
        log.info("Started {} with {} container(s)", instance.getId(), containerIds.size());
        return updated;
    }

    @Override
    public Instance stop(Instance instance) {
        var updated = instance.copy();
        ProcessResult down = compose.down(composeFile(instance), TopologyRenderer.projectName(instance.getId()), false);
        if (!down.succeeded()) {
            log.warn("docker compose down reported errors for {}: {}", instance.getId(), down.diagnostics());
        }
        // down removes the containers; a restart records fresh ids
        updated.setContainerIds(List.of());
        updated.transitionTo(InstanceStatus.STOPPED);
        return updated;
    }

    @Override
    public DestroyReport destroy(Instance instance) {
        var failures = new ArrayList<String>();
        Path instanceDir = instanceDir(instance);
        Path composeFile = composeFile(instance);

        boolean runtimeRemoved;
        if (Files.exists(composeFile)) {
            ProcessResult down = compose.down(composeFile, TopologyRenderer.projectName(instance.getId()), true);
            runtimeRemoved = down.succeeded();
            if (!runtimeRemoved) {
                failures.add("runtime teardown: " + down.diagnostics());
                log.warn("docker compose down -v failed for {}: {}", instance.getId(), down.diagnostics());
            }
        } else {
            runtimeRemoved = true;
        }

        boolean filesRemoved;
        try {
            deleteTree(instanceDir);
            filesRemoved = true;
        } catch (IOException | UncheckedIOException e) {
            filesRemoved = false;
            failures.add("artefact removal: " + e.getMessage());
            log.warn("Failed to remove {} for {}", instanceDir, instance.getId(), e);
        }

        List<Integer> released = List.of();
        if (runtimeRemoved || filesRemoved) {
            released = List.copyOf(instance.getAllocatedPorts());
            allocator.release(released);
        }
        return new DestroyReport(runtimeRemoved, filesRemoved, released, List.copyOf(failures));
    }

    @Override
    public InstanceStatus health(Instance instance) {
        if (instance.getContainerIds().isEmpty()) {
            return InstanceStatus.ERROR;
        }
        int running = 0;
        int ready = 0;
        try {
            for (String containerId : instance.getContainerIds()) {
                InspectContainerResponse.ContainerState state = dockerClient.inspectContainerCmd(containerId).exec().getState();
                if (Boolean.TRUE.equals(state.getRunning())) {
                    running++;
                    // no health probe configured counts as healthy
                    if (state.getHealth() == null || HEALTHY.equals(state.getHealth().getStatus())) {
                        ready++;
                    }
                }
            }
        } catch (RuntimeException e) {
            log.warn("Health inspection failed for {}: {}", instance.getId(), e.getMessage());
            return InstanceStatus.ERROR;
        }

        int total = instance.getContainerIds().size();
        if (ready == total) {
            return InstanceStatus.RUNNING;
        }
        return running > 0 ? InstanceStatus.STARTING : InstanceStatus.STOPPED;
    }

    @Override
    public String logs(Instance instance, String component, int tail) {
        var sections = new ArrayList<String>();
        for (String containerId : instance.getContainerIds()) {
            String name;
            try {
                name = dockerClient.inspectContainerCmd(containerId).exec().getName();
            } catch (RuntimeException e) {
                log.debug("Skipping logs for container {}: {}", containerId, e.getMessage());
                continue;
            }
            name = name != null && name.startsWith("/") ? name.substring(1) : name;
            if (component != null && !component.isBlank() && (name == null || !name.contains(component))) {
                continue;
            }
            sections.add("=== " + name + " ===\n" + tail(containerId, tail));
        }
        return String.join("\n\n", sections);
    }

    private String tail(String containerId, int lines) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .withTail(lines)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(LOG_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reading logs of container {}", containerId);
        }
        return sb.toString();
    }

    private Map<PortRole, List<Integer>> allocatePorts(Map<PortRole, Integer> counts) {
        var ports = new EnumMap<PortRole, List<Integer>>(PortRole.class);
        try {
            counts.forEach((role, count) -> {
                if (count > 0) {
                    ports.put(role, allocator.allocate(role, count));
                }
            });
        } catch (RuntimeException e) {
            ports.values().forEach(allocator::release);
            throw e;
        }
        return ports;
    }

    private void write(Path instanceDir, RenderedDeployment deployment) {
        try {
            Files.createDirectories(instanceDir.resolve(DEFAULTS_DIR));
            Files.writeString(instanceDir.resolve(COMPOSE_FILE), deployment.descriptor());
            Files.writeString(instanceDir.resolve(DEFAULTS_DIR).resolve(DEFAULTS_FILE), deployment.productConfig());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write deployment files to " + instanceDir, e);
        }
    }

    Path instanceDir(Instance instance) {
        return instancesDir.resolve(instance.getId());
    }

    private Path composeFile(Instance instance) {
        return instanceDir(instance).resolve(COMPOSE_FILE);
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    private static void deleteRecursively(Path dir) {
        try {
            deleteTree(dir);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to clean up {}", dir, e);
        }
    }

    private static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
