package com.fauxcloud.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "fauxcloud.orchestration")
public class OrchestrationProperties {

    private String dataDir = System.getProperty("user.home") + "/.faux-cloud";
    private String networkPrefix = "fsc";
    private String host = "localhost";
    private Docker docker = new Docker();
    private AdminApi adminApi = new AdminApi();

    // -- Docker accessors (delegate to nested) --
    public String getDockerHost() { return docker.host; }
    public String getDockerCommand() { return docker.command; }
    public String getImageRepository() { return docker.imageRepository; }
    public int getComposeTimeoutSeconds() { return docker.composeTimeoutSeconds; }

    public String getAdminApiBaseUrl() { return adminApi.baseUrl; }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public String getNetworkPrefix() { return networkPrefix; }
    public void setNetworkPrefix(String networkPrefix) { this.networkPrefix = networkPrefix; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public AdminApi getAdminApi() { return adminApi; }
    public void setAdminApi(AdminApi adminApi) { this.adminApi = adminApi; }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private String command = "docker";
        private String imageRepository = "splunk/splunk";
        private int composeTimeoutSeconds = 600;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getImageRepository() { return imageRepository; }
        public void setImageRepository(String imageRepository) { this.imageRepository = imageRepository; }
        public int getComposeTimeoutSeconds() { return composeTimeoutSeconds; }
        public void setComposeTimeoutSeconds(int composeTimeoutSeconds) { this.composeTimeoutSeconds = composeTimeoutSeconds; }
    }

    /**
     * Simulated admin-config API advertised in instance endpoints.
     */
    public static class AdminApi {
        private String baseUrl = "http://localhost:8800";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }
}
