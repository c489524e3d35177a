package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.health.HealthCheckService;
import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.model.InstanceStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: faux-cloud health [instance-id]
 * <p>
 * Without an argument, runs the service health checks. With an instance ID, reports that
 * instance's container health.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check service or instance health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Instance ID")
    private String instanceId;

    private final HealthCheckService healthCheckService;
    private final InstanceManager instanceManager;

    public HealthCommand(HealthCheckService healthCheckService, InstanceManager instanceManager) {
        this.healthCheckService = healthCheckService;
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        if (instanceId != null) {
            return InstanceCommands.run(() -> {
                InstanceStatus status = instanceManager.getHealth(instanceId);
                System.out.println(instanceId + ": " + ConsoleOutput.status(status));
                return status == InstanceStatus.ERROR ? InstanceCommands.FAILED : InstanceCommands.OK;
            });
        }

        ConsoleOutput.printBanner();
        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
            return InstanceCommands.OK;
        }
        ConsoleOutput.error("Overall: one or more components down");
        return InstanceCommands.FAILED;
    }
}
