package com.fauxcloud.orchestration;

import com.fauxcloud.orchestration.allocation.PortAllocator;
import com.fauxcloud.orchestration.allocation.SocketPortProbe;
import com.fauxcloud.orchestration.topology.TopologyRenderer;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestrationConfig {

    @Bean
    public DockerClient dockerClient(OrchestrationProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDockerHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public PortAllocator portAllocator() {
        return new PortAllocator(new SocketPortProbe());
    }

    @Bean
    public TopologyRenderer topologyRenderer() {
        return new TopologyRenderer();
    }

    @Bean
    public ComposeCli composeCli(OrchestrationProperties properties) {
        return new ComposeCli(properties.getDockerCommand(), properties.getComposeTimeoutSeconds());
    }

    @Bean
    public OrchestrationBackend orchestrationBackend(DockerClient dockerClient, ComposeCli composeCli,
                                                     PortAllocator portAllocator, TopologyRenderer topologyRenderer,
                                                     OrchestrationProperties properties) {
        return new ComposeOrchestrationBackend(
                dockerClient,
                composeCli,
                portAllocator,
                topologyRenderer,
                new EndpointResolver(properties.getHost(), properties.getAdminApiBaseUrl()),
                properties.dataPath(),
                properties.getNetworkPrefix(),
                properties.getImageRepository());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
