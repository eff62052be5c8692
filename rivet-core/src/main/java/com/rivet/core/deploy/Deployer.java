package com.rivet.core.deploy;

import com.rivet.core.cache.CacheManager;
import com.rivet.core.exception.DelegatedFailureException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.process.MavenInvoker;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.ProcessRunner;
import com.rivet.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a deployment: checks, pre-deploy hooks, build, tests, the strategy for the
 * configured deployment type, then post-deploy tasks and the health check.
 *
 * <p>In dry-run mode the runner only prints commands; local file changes (cache clearing)
 * and the health check are announced but not performed.
 */
public class Deployer {

    private static final Logger log = LoggerFactory.getLogger(Deployer.class);

    static final List<String> REQUIRED_PATHS = List.of(ProjectLayout.BUILD_FILE, ProjectLayout.MAIN_JAVA);

    private final Path projectRoot;
    private final MavenInvoker maven;
    private final ProcessRunner runner;
    private final HealthCheck healthCheck;
    private final Map<String, String> environment;
    private final DeploymentListener listener;

    public Deployer(
        Path projectRoot,
        MavenInvoker maven,
        ProcessRunner runner,
        HealthCheck healthCheck,
        Map<String, String> environment,
        DeploymentListener listener
    ) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.maven = Objects.requireNonNull(maven, "maven must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck must not be null");
        this.environment = environment == null ? Map.of() : environment;
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Deploys to a target.
     *
     * @param target target name, selects the Maven profile
     * @param config target configuration
     * @param skipBuild skip packaging
     * @param dryRun print instead of acting
     * @throws DelegatedFailureException if any external command fails
     */
    public void deploy(String target, DeploymentConfig config, boolean skipBuild, boolean dryRun) {
        log.info("Deploying to {} via {} (skipBuild={}, dryRun={})", target, config.deploymentType(), skipBuild, dryRun);

        listener.step("Running pre-deployment checks...");
        preChecks(config);
        runHooks(config.preDeployCommands(), "pre-deploy");

        if (!skipBuild) {
            listener.step("Building application for deployment...");
            runner.runOrFail(maven.goals(List.of("clean", "package", "-DskipTests", "-P" + target)).inheritingIo());
        }

        listener.step("Running tests...");
        runner.runOrFail(maven.goals(List.of("test")).inheritingIo());

        switch (config.deploymentType()) {
            case "docker" -> deployDocker(config);
            case "kubernetes" -> deployKubernetes(config);
            case "server" -> deployServer(config, dryRun);
            default -> throw new RivetException("Unknown deployment type '" + config.deploymentType()
                + "'. Supported types: server, docker, kubernetes");
        }

        listener.step("Running post-deployment tasks...");
        runner.runOrFail(maven.task("migrate", List.of()).inheritingIo());
        if (dryRun) {
            listener.step("Would clear caches");
        } else {
            new CacheManager(projectRoot).clear();
        }
        runHooks(config.postDeployCommands(), "post-deploy");
        healthCheck(config, dryRun);
    }

    private void preChecks(DeploymentConfig config) {
        for (String required : REQUIRED_PATHS) {
            if (!Files.exists(projectRoot.resolve(required))) {
                throw new RivetException("Required file not found: " + required);
            }
        }
        for (String variable : config.environmentVariables().keySet()) {
            if (!environment.containsKey(variable)) {
                listener.warning("Environment variable not set: " + variable);
            }
        }
    }

    private void runHooks(List<String> commands, String phase) {
        for (String command : commands) {
            listener.step("Running " + phase + " command: " + command);
            runner.runOrFail(ProcessInvocation.of(projectRoot, "sh", "-c", command));
        }
    }

    private void deployDocker(DeploymentConfig config) {
        String image = require(config.dockerImage(), "docker_image");
        listener.step("Building Docker image " + image);
        runner.runOrFail(ProcessInvocation.of(projectRoot, "docker", "build", "-t", image, ".").inheritingIo());

        String registry = config.dockerRegistry() != null ? config.dockerRegistry() : environment.get("DOCKER_REGISTRY");
        if (registry != null && !registry.isBlank()) {
            String remote = registry + "/" + image;
            listener.step("Pushing " + remote);
            runner.runOrFail(ProcessInvocation.of(projectRoot, "docker", "tag", image, remote));
            runner.runOrFail(ProcessInvocation.of(projectRoot, "docker", "push", remote).inheritingIo());
        }
    }

    private void deployKubernetes(DeploymentConfig config) {
        String namespace = config.kubernetesNamespace();
        String deployment = config.kubernetesDeployment() != null
            ? config.kubernetesDeployment()
            : projectRoot.toAbsolutePath().normalize().getFileName().toString();
        listener.step("Applying manifests in k8s/ to namespace " + namespace);
        runner.runOrFail(ProcessInvocation.of(projectRoot, "kubectl", "apply", "-f", "k8s/", "-n", namespace));
        runner.runOrFail(ProcessInvocation.of(projectRoot,
            "kubectl", "rollout", "status", "deployment/" + deployment, "-n", namespace).inheritingIo());
    }

    private void deployServer(DeploymentConfig config, boolean dryRun) {
        String host = require(config.host(), "host");
        String user = require(config.user(), "user");
        String path = require(config.path(), "path");
        String port = String.valueOf(config.port());
        String jar = findJar(dryRun);
        String service = config.service() != null
            ? config.service()
            : projectRoot.toAbsolutePath().normalize().getFileName().toString();

        listener.step("Copying " + jar + " to " + user + "@" + host + ":" + path);
        runner.runOrFail(ProcessInvocation.of(projectRoot, "scp", "-P", port, jar, user + "@" + host + ":" + path + "/"));
        listener.step("Restarting service " + service);
        runner.runOrFail(ProcessInvocation.of(projectRoot,
            "ssh", "-p", port, user + "@" + host, "sudo systemctl restart " + service));
    }

    private String findJar(boolean dryRun) {
        try {
            List<Path> jars = FileUtils.findFiles(projectRoot.resolve("target"), "*.jar").stream()
                .filter(jar -> {
                    String name = jar.getFileName().toString();
                    return !name.startsWith("original-") && !name.endsWith("-sources.jar") && !name.endsWith("-javadoc.jar");
                })
                .toList();
            if (!jars.isEmpty()) {
                return projectRoot.relativize(jars.get(0)).toString();
            }
        } catch (IOException e) {
            throw new RivetException("Failed to look for the application jar in target/", e);
        }
        if (dryRun) {
            return "target/*.jar";
        }
        throw new RivetException("No application jar found in target/. Build the project first.");
    }

    private void healthCheck(DeploymentConfig config, boolean dryRun) {
        if (config.healthCheckUrl() == null || config.healthCheckUrl().isBlank()) {
            return;
        }
        URI uri = URI.create(config.healthCheckUrl());
        if (dryRun) {
            listener.step("Would check health at " + uri);
            return;
        }
        listener.step("Running health check against " + uri);
        int status = healthCheck.check(uri);
        if (status < 200 || status >= 300) {
            throw new RivetException("Health check failed: " + uri + " answered " + status);
        }
    }

    private static String require(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new RivetException("Deployment config is missing '" + key + "'");
        }
        return value;
    }
}
