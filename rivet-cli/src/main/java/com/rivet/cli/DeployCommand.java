package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.deploy.Deployer;
import com.rivet.core.deploy.DeploymentConfig;
import com.rivet.core.deploy.DeploymentListener;
import com.rivet.core.deploy.DeploymentTemplates;
import com.rivet.core.deploy.HealthCheck;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.process.DryRunProcessRunner;
import com.rivet.core.process.ProcessRunner;
import com.rivet.core.template.TemplateRenderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Deployment commands: {@code deploy [target]} and {@code deploy:init [target]}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rivet deploy:init staging
 * rivet deploy staging --dry-run
 * rivet deploy --skip-build
 * }</pre>
 */
public class DeployCommand implements CommandFamily {

    private final HealthCheck healthCheck;

    public DeployCommand(HealthCheck healthCheck) {
        this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck must not be null");
    }

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("deploy")
            .description("Deploy the application")
            .parameter(ParameterDefinition.optional("target", "Deployment target (default: production)"))
            .flag(FlagDefinition.bool("skip-build", "Skip building and testing"))
            .flag(FlagDefinition.bool("dry-run", "Print the commands without running them"))
            .build(), this::deploy);
        registry.register(CommandDefinition.builder("deploy", "init")
            .description("Create a deployment configuration for a target")
            .parameter(ParameterDefinition.optional("target", "Deployment target (default: production)"))
            .build(), this::init);
    }

    private void deploy(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        ConfigDocument config = ProjectSupport.loadConfig(context);
        String target = command.argument(0).orElse(DeploymentConfig.DEFAULT_TARGET);
        boolean dryRun = command.booleanFlag("dry-run");
        DeploymentConfig deployment = DeploymentConfig.load(root, target);

        ProcessRunner runner = dryRun ? new DryRunProcessRunner(context.out()) : context.processRunner();
        context.info((dryRun ? "Dry run: deploying" : "Deploying") + " to " + target
            + " (" + deployment.deploymentType() + ")");

        Deployer deployer = new Deployer(root, ProjectSupport.maven(context, config), runner, healthCheck,
            context.environment(), new DeploymentListener() {
                @Override
                public void step(String message) {
                    context.info(message);
                }

                @Override
                public void warning(String message) {
                    context.warning(message);
                }
            });
        deployer.deploy(target, deployment, command.booleanFlag("skip-build"), dryRun);

        context.success(dryRun ? "Dry run completed, no changes were made" : "Deployment to " + target + " completed");
    }

    private void init(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        String target = command.argument(0).orElse(DeploymentConfig.DEFAULT_TARGET);
        String appName = ProjectSupport.loadConfig(context).getString("app.name")
            .orElse(root.getFileName().toString());
        Path file = DeploymentConfig.fileFor(root, target);
        String display = new ProjectLayout(root, ProjectLayout.DEFAULT_PACKAGE).display(file);

        if (new DeploymentTemplates(new TemplateRenderer()).create(root, target, appName)) {
            context.success("Created deployment configuration " + display);
        } else {
            context.warning("Deployment configuration already exists: " + display);
        }
    }
}
