package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop an instance, keeping its data")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    private final InstanceManager instanceManager;

    public StopCommand(InstanceManager instanceManager) {
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            instanceManager.stop(instanceId);
            ConsoleOutput.success("Stopped " + instanceId);
            return InstanceCommands.OK;
        });
    }
}
