package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.lifecycle.InstanceManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "logs", mixinStandardHelpOptions = true, description = "Print recent container logs")
@Component
public class LogsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instance ID")
    private String instanceId;

    @Option(names = {"--component", "-c"}, description = "Only containers whose name contains this text")
    private String component;

    @Option(names = {"--tail", "-n"}, description = "Lines per container (default: ${DEFAULT-VALUE})", defaultValue = "100")
    private int tail;

    private final InstanceManager instanceManager;

    public LogsCommand(InstanceManager instanceManager) {
        this.instanceManager = instanceManager;
    }

    @Override
    public Integer call() throws Exception {
        return InstanceCommands.run(() -> {
            String logs = instanceManager.getLogs(instanceId, component, tail);
            if (logs.isEmpty()) {
                ConsoleOutput.info("No logs (is the instance started?)");
            } else {
                System.out.println(logs);
            }
            return InstanceCommands.OK;
        });
    }
}
