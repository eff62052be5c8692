package com.rivet.cli;

import com.rivet.core.command.CommandRegistry;

/**
 * A group of related commands (one verb) that registers its definitions and handlers.
 */
public interface CommandFamily {

    void register(CommandRegistry registry);
}
