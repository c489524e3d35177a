package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a provisioned or stopped instance")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    private final InstanceManager instanceManager;

    public StartCommand(InstanceManager instanceManager) {
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            Instance instance = instanceManager.start(instanceId);
            if (instance.getStatus() == InstanceStatus.ERROR) {
                ConsoleOutput.error("Failed to start " + instanceId + ": " + instance.getErrorMessage());
                return InstanceCommands.FAILED;
            }
            ConsoleOutput.success("Starting " + instanceId + " (" + instance.getContainerIds().size() + " containers)");
            return InstanceCommands.OK;
        });
    }
}
