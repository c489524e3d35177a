package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.lifecycle.LifecycleProperties;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.InstanceCreateRequest;
import com.fauxcloud.core.model.InstanceStatus;
import com.fauxcloud.core.model.Topology;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: faux-cloud create &lt;name&gt;
 * <p>
 * Creates and provisions an instance, optionally starting it and waiting until it is ready.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a new instance")
@Component
public class CreateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance name (lowercase letters, digits and hyphens)")
    private String name;

    @Option(names = {"--topology", "-t"}, description = "Topology: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "STANDALONE")
    private Topology topology;

    @Option(names = "--ttl", description = "Time-to-live in hours (default: ${DEFAULT-VALUE})", defaultValue = "24")
    private int ttlHours;

    @Option(names = "--version-tag", description = "Product version (default: ${DEFAULT-VALUE})",
            defaultValue = InstanceConfig.DEFAULT_PRODUCT_VERSION)
    private String productVersion;

    @Option(names = "--experience", description = "victoria or classic (default: ${DEFAULT-VALUE})", defaultValue = "victoria")
    private String experience;

    @Option(names = "--search-heads", description = "Search heads for clustered topologies", defaultValue = "1")
    private int searchHeads;

    @Option(names = "--indexers", description = "Indexers for clustered topologies", defaultValue = "1")
    private int indexers;

    @Option(names = "--replication-factor", defaultValue = "1")
    private int replicationFactor;

    @Option(names = "--search-factor", defaultValue = "1")
    private int searchFactor;

    @Option(names = "--memory", description = "Memory per container in MB (default: ${DEFAULT-VALUE})", defaultValue = "2048")
    private int memoryMb;

    @Option(names = "--cpus", description = "CPU cores per container (default: ${DEFAULT-VALUE})", defaultValue = "1.0")
    private double cpuCores;

    @Option(names = "--no-ingestion", description = "Disable the HTTP ingestion endpoint")
    private boolean noIngestion;

    @Option(names = "--app", description = "App to pre-install (repeatable)")
    private List<String> apps = List.of();

    @Option(names = {"--label", "-l"}, description = "Label key=value (repeatable)")
    private Map<String, String> labels = new LinkedHashMap<>();

    @Option(names = "--start", description = "Start the instance after provisioning")
    private boolean start;

    @Option(names = "--wait", description = "Start and wait until the instance is running")
    private boolean waitForReady;

    @Option(names = "--wait-timeout", description = "Seconds to wait with --wait (default: from configuration)")
    private Long waitTimeoutSeconds;

    private final InstanceManager instanceManager;
    private final LifecycleProperties lifecycleProperties;
    private final Clock clock;

    public CreateCommand(InstanceManager instanceManager, LifecycleProperties lifecycleProperties, Clock clock) {
        this.instanceManager = instanceManager;
        this.lifecycleProperties = lifecycleProperties;
        this.clock = clock;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            var config = InstanceConfig.builder()
                    .topology(topology)
                    .productVersion(productVersion)
                    .experience(experience)
                    .searchHeadCount(searchHeads)
                    .indexerCount(indexers)
                    .replicationFactor(replicationFactor)
                    .searchFactor(searchFactor)
                    .memoryMb(memoryMb)
                    .cpuCores(cpuCores)
                    .ingestionEnabled(!noIngestion)
                    .preinstallApps(apps)
                    .build();

            Instance instance = instanceManager.create(new InstanceCreateRequest(name, config, ttlHours, labels));
            ConsoleOutput.success("Created " + instance.getId() + " (" + instance.getName() + ")");

            if (start || waitForReady) {
                instance = instanceManager.start(instance.getId());
                if (instance.getStatus() == InstanceStatus.ERROR) {
                    ConsoleOutput.instanceDetail(instance, clock.instant());
                    return InstanceCommands.FAILED;
                }
                ConsoleOutput.info("Starting " + instance.getId());
            }
            if (waitForReady) {
                Duration timeout = waitTimeoutSeconds != null
                        ? Duration.ofSeconds(waitTimeoutSeconds)
                        : lifecycleProperties.getReadyTimeout();
                ConsoleOutput.info("Waiting up to " + timeout.toSeconds() + "s for " + instance.getId());
                instance = instanceManager.waitForReady(instance.getId(), timeout);
                ConsoleOutput.success("Instance is running");
            }
            ConsoleOutput.instanceDetail(instance, clock.instant());
            return InstanceCommands.OK;
        });
    }
}
