package com.rivet.core.deploy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deployment settings for one target, read from {@code deploy/<target>.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * deployment_type: docker
 * docker_image: shop
 * docker_registry: registry.example.com
 * environment_variables:
 *   APP_ENV: production
 * pre_deploy_commands:
 *   - echo 'Starting deployment...'
 * health_check_url: https://shop.example.com/api/health
 * }</pre>
 *
 * @param deploymentType {@code server}, {@code docker} or {@code kubernetes}
 * @param host server host
 * @param port SSH port
 * @param user SSH user
 * @param path remote directory the jar is copied to
 * @param service systemd unit restarted after a server deployment
 * @param dockerImage image name
 * @param dockerRegistry registry to push to, falls back to {@code DOCKER_REGISTRY}
 * @param kubernetesNamespace namespace for {@code kubectl}
 * @param kubernetesDeployment deployment watched for rollout
 * @param environmentVariables variables expected in the deploying shell
 * @param preDeployCommands shell commands run before building
 * @param postDeployCommands shell commands run after deploying
 * @param healthCheckUrl URL that must answer 2xx after deploying
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeploymentConfig(
    @JsonProperty("deployment_type") String deploymentType,
    @JsonProperty("host") String host,
    @JsonProperty("port") Integer port,
    @JsonProperty("user") String user,
    @JsonProperty("path") String path,
    @JsonProperty("service") String service,
    @JsonProperty("docker_image") String dockerImage,
    @JsonProperty("docker_registry") String dockerRegistry,
    @JsonProperty("kubernetes_namespace") String kubernetesNamespace,
    @JsonProperty("kubernetes_deployment") String kubernetesDeployment,
    @JsonProperty("environment_variables") Map<String, String> environmentVariables,
    @JsonProperty("pre_deploy_commands") List<String> preDeployCommands,
    @JsonProperty("post_deploy_commands") List<String> postDeployCommands,
    @JsonProperty("health_check_url") String healthCheckUrl
) {
    private static final Logger log = LoggerFactory.getLogger(DeploymentConfig.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DIRECTORY = "deploy";
    public static final String DEFAULT_TARGET = "production";

    /**
     * Compact constructor with defaults.
     */
    public DeploymentConfig {
        deploymentType = deploymentType == null ? "server" : deploymentType.toLowerCase(Locale.ROOT);
        port = port == null ? 22 : port;
        kubernetesNamespace = kubernetesNamespace == null ? "default" : kubernetesNamespace;
        environmentVariables = environmentVariables == null ? Map.of() : Map.copyOf(environmentVariables);
        preDeployCommands = preDeployCommands == null ? List.of() : List.copyOf(preDeployCommands);
        postDeployCommands = postDeployCommands == null ? List.of() : List.copyOf(postDeployCommands);
    }

    public static Path fileFor(Path projectRoot, String target) {
        return projectRoot.resolve(DIRECTORY).resolve(target + ".yaml");
    }

    /**
     * Loads a target's configuration.
     *
     * @param projectRoot project root
     * @param target target name
     * @return parsed configuration
     * @throws RivetException if the file is missing or unreadable
     * @throws ParseException if the file is not valid YAML for a deployment
     */
    public static DeploymentConfig load(Path projectRoot, String target) {
        Path file = fileFor(projectRoot, target);
        if (!Files.isRegularFile(file)) {
            throw new RivetException("Deployment config not found: " + DIRECTORY + "/" + target
                + ".yaml. Run 'rivet deploy:init " + target + "' to create one.");
        }
        try {
            log.debug("Loading deployment config from: {}", file);
            DeploymentConfig config = YAML_MAPPER.readValue(file.toFile(), DeploymentConfig.class);
            if (config == null) {
                throw new ParseException("Deployment config " + file.getFileName() + " is empty");
            }
            return config;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new ParseException("Invalid deployment config " + file.getFileName() + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new RivetException("Failed to read deployment config " + file, e);
        }
    }
}
