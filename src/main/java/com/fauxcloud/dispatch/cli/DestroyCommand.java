package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "destroy", mixinStandardHelpOptions = true,
        description = "Destroy an instance and delete its containers, volumes and files")
@Component
public class DestroyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    private final InstanceManager instanceManager;

    public DestroyCommand(InstanceManager instanceManager) {
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            instanceManager.destroy(instanceId);
            ConsoleOutput.success("Destroyed " + instanceId);
            return InstanceCommands.OK;
        });
    }
}
