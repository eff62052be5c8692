package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Queue commands, delegated to the application's console kernel.
 *
 * <p>{@code queue:work} runs in the foreground until the worker exits or the user interrupts it.
 * {@code queue:retry} re-submits failed jobs on request; the tool never retries on its own.
 */
public class QueueCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("queue", "work")
            .description("Start processing jobs on the queue")
            .flag(FlagDefinition.string("queue", "Queue to listen on").withDefault("default"))
            .flag(FlagDefinition.integer("max-jobs", "Stop after processing this many jobs"))
            .flag(FlagDefinition.integer("memory", "Memory limit in megabytes").withDefault(128))
            .flag(FlagDefinition.integer("sleep", "Seconds to sleep when no job is available").withDefault(3))
            .build(), this::work);
        registry.register(CommandDefinition.builder("queue", "restart")
            .description("Restart queue worker daemons after their current job")
            .build(), (command, context) -> ProjectSupport.runTask(context, "queue:restart", List.of()));
        registry.register(CommandDefinition.builder("queue", "failed")
            .description("List all failed queue jobs")
            .build(), (command, context) -> ProjectSupport.runTask(context, "queue:failed", List.of()));
        registry.register(CommandDefinition.builder("queue", "retry")
            .description("Retry a failed queue job, or all of them")
            .parameter(ParameterDefinition.optional("id", "Failed job id (default: all)"))
            .build(), (command, context) -> ProjectSupport.runTask(context, "queue:retry",
                List.of(command.argument(0).orElse("all"))));
        registry.register(CommandDefinition.builder("queue", "flush")
            .description("Delete all failed queue jobs")
            .build(), (command, context) -> ProjectSupport.runTask(context, "queue:flush", List.of()));
    }

    private void work(CommandDescriptor command, CommandContext context) {
        String queue = command.stringFlag("queue").orElse("default");
        List<String> arguments = new ArrayList<>(List.of("--queue", queue));
        command.intFlag("max-jobs").ifPresent(max -> arguments.addAll(List.of("--max-jobs", String.valueOf(max))));
        command.intFlag("memory").ifPresent(mb -> arguments.addAll(List.of("--memory", String.valueOf(mb))));
        command.intFlag("sleep").ifPresent(s -> arguments.addAll(List.of("--sleep", String.valueOf(s))));

        context.info("Processing jobs from the '" + queue + "' queue");
        ProjectSupport.runTask(context, "queue:work", arguments);
    }
}
