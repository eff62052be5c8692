package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.scaffold.ProjectScaffolder;
import com.rivet.core.scaffold.ProjectTemplate;
import com.rivet.core.scaffold.ScaffoldRequest;
import com.rivet.core.scaffold.ScaffoldResult;
import com.rivet.core.template.TemplateRenderer;

import java.nio.file.Path;

/**
 * Command to create a new Rivet project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rivet new shop
 * rivet new shop --template api --package com.acme.shop
 * rivet new shop --template ./my-template --path ~/code --git=false
 * }</pre>
 */
public class NewCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("new")
            .description("Create a new Rivet application")
            .parameter(ParameterDefinition.required("name", "Project name, also its directory"))
            .flag(FlagDefinition.string("template", "Template: default, api, web, minimal or a directory")
                .withShortName("t").withDefault(ProjectTemplate.DEFAULT))
            .flag(FlagDefinition.string("path", "Directory to create the project in").withShortName("p"))
            .flag(FlagDefinition.string("package", "Base Java package (default: com.example.<name>)"))
            .flag(FlagDefinition.bool("git", "Initialize a git repository").withDefault(Boolean.TRUE))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        String name = command.requiredArgument(0);
        String template = command.stringFlag("template").orElse(ProjectTemplate.DEFAULT);
        if (!ProjectTemplate.BUILT_IN.contains(template)) {
            template = context.workingDirectory().resolve(template).toString();
        }
        Path parent = command.stringFlag("path")
            .map(context.workingDirectory()::resolve)
            .orElse(context.workingDirectory());

        context.info("Creating new Rivet application '" + name + "'...");
        ProjectScaffolder scaffolder = new ProjectScaffolder(new TemplateRenderer());
        ScaffoldResult result = scaffolder.scaffold(new ScaffoldRequest(
            name, template, parent, command.stringFlag("package").orElse(null), command.booleanFlag("git")));

        context.success("Created application '" + name + "' in " + result.root()
            + " (" + result.files().size() + " files, package " + result.basePackage() + ")");
        if (result.gitInitialized()) {
            context.success("Initialized git repository");
        }

        context.out().println();
        context.out().println("Next steps:");
        context.out().println("  cd " + name);
        context.out().println("  rivet config:generate-key   # Generate application key");
        context.out().println("  rivet migrate               # Run database migrations");
        context.out().println("  rivet serve                 # Start development server");
    }
}
