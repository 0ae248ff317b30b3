package io.huskytests.core.container;

/**
 * Thrown when a container runtime command fails and its success was required,
 * or when the command could not be started at all.
 */
public class ContainerCommandException extends RuntimeException {

    private final String commandLine;
    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public ContainerCommandException(String commandLine, CommandResult result) {
        super("Command execution failed\n Tried to run " + commandLine
                + "\nGot error " + result.exitCode() + " " + result.stderr()
                + "\nOutput:\n" + result.stdout());
        this.commandLine = commandLine;
        this.exitCode = result.exitCode();
        this.stdout = result.stdout();
        this.stderr = result.stderr();
    }

    public ContainerCommandException(String commandLine, String message, Throwable cause) {
        super(message + ": " + commandLine, cause);
        this.commandLine = commandLine;
        this.exitCode = -1;
        this.stdout = "";
        this.stderr = "";
    }

    public String getCommandLine() { return commandLine; }
    public int getExitCode() { return exitCode; }
    public String getStdout() { return stdout; }
    public String getStderr() { return stderr; }
}
