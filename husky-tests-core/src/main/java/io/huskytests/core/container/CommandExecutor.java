package io.huskytests.core.container;

/**
 * Runs a command to completion. Implementations block the calling thread until
 * the child process exits.
 */
@FunctionalInterface
public interface CommandExecutor {

    CommandResult execute(ContainerCommand command);
}
