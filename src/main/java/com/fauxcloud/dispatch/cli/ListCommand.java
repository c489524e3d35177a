package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List instances")
@Component
public class ListCommand implements Callable<Integer> {

    @Option(names = {"--status", "-s"}, description = "Only instances in this status")
    private InstanceStatus status;

    @Option(names = {"--label", "-l"}, description = "Only instances carrying label key=value (repeatable)")
    private Map<String, String> labels = new LinkedHashMap<>();

    private final InstanceManager instanceManager;
    private final Clock clock;

    public ListCommand(InstanceManager instanceManager, Clock clock) {
        this.instanceManager = instanceManager;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        List<Instance> instances = instanceManager.list(status, labels);
        if (instances.isEmpty()) {
            ConsoleOutput.info("No instances");
            return InstanceCommands.OK;
        }
        System.out.printf("%-22s %-24s %-22s %-13s %s%n", "ID", "NAME", "TOPOLOGY", "STATUS", "EXPIRES");
        Instant now = clock.instant();
        instances.forEach(instance -> ConsoleOutput.instanceRow(instance, now));
        return InstanceCommands.OK;
    }
}
