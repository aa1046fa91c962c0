package com.groupdispatch.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.groupdispatch.core.dispatch.DispatchProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "groupdispatch.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "groupdispatch.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public SandboxProvider dockerSandboxProvider(DockerClient dockerClient,
                                                 SandboxProperties sandboxProperties,
                                                 DispatchProperties dispatchProperties) {
        return new DockerSandboxProvider(dockerClient, sandboxProperties, dispatchProperties);
    }

    @Bean
    @ConditionalOnProperty(name = "groupdispatch.sandbox.provider", havingValue = "local")
    public SandboxProvider localSandboxProvider(SandboxProperties sandboxProperties,
                                                DispatchProperties dispatchProperties) {
        return new LocalSandboxProvider(sandboxProperties, dispatchProperties);
    }

    @Bean
    public SandboxEventDecoder sandboxEventDecoder(ObjectMapper objectMapper) {
        return new SandboxEventDecoder(objectMapper);
    }
}
