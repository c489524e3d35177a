package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import com.fauxcloud.core.model.Instance;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "extend", mixinStandardHelpOptions = true, description = "Extend an instance's time-to-live")
@Component
public class ExtendCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    @Option(names = "--hours", description = "Hours to add (default: ${DEFAULT-VALUE})", defaultValue = "24")
    private int hours;

    private final InstanceManager instanceManager;

    public ExtendCommand(InstanceManager instanceManager) {
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            Instance instance = instanceManager.extendTtl(instanceId, hours);
            ConsoleOutput.success(instanceId + " now expires at " + instance.getExpiresAt());
            return InstanceCommands.OK;
        });
    }
}
