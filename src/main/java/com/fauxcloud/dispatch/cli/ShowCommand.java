package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.util.concurrent.Callable;

@Command(name = "show", mixinStandardHelpOptions = true, description = "Show instance details")
@Component
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    private final InstanceManager instanceManager;
    private final Clock clock;

    public ShowCommand(InstanceManager instanceManager, Clock clock) {
        this.instanceManager = instanceManager;
        this.clock = clock;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            ConsoleOutput.instanceDetail(instanceManager.get(instanceId), clock.instant());
            return InstanceCommands.OK;
        });
    }
}
