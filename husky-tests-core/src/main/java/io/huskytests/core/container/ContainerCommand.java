package io.huskytests.core.container;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One invocation of the container runtime: the argument vector plus the
 * directory it runs in.
 *
 * <p>{@link #commandLine()} renders a stable display form in which path and
 * filter arguments are wrapped in double quotes; two equal commands always
 * render byte-identical lines.
 */
public final class ContainerCommand {

    /** A single argument and whether its display form is quoted. */
    public record Argument(String value, boolean quoted) {

        String display() {
            return quoted ? '"' + value + '"' : value;
        }
    }

    private final List<Argument> arguments;
    private final Path workingDirectory;

    private ContainerCommand(List<Argument> arguments, Path workingDirectory) {
        this.arguments = List.copyOf(arguments);
        this.workingDirectory = workingDirectory;
    }

    public static Builder builder(String executable) {
        return new Builder(executable);
    }

    /** Raw arguments, executable first, as handed to the operating system. */
    public List<String> argv() {
        return arguments.stream().map(Argument::value).collect(Collectors.toList());
    }

    public String commandLine() {
        return arguments.stream().map(Argument::display).collect(Collectors.joining(" "));
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContainerCommand)) return false;
        ContainerCommand other = (ContainerCommand) o;
        return arguments.equals(other.arguments) && workingDirectory.equals(other.workingDirectory);
    }

    @Override
    public int hashCode() {
        return 31 * arguments.hashCode() + workingDirectory.hashCode();
    }

    @Override
    public String toString() {
        return commandLine() + " (in " + workingDirectory + ")";
    }

    public static final class Builder {
        private final List<Argument> arguments = new ArrayList<>();
        private Path workingDirectory;

        private Builder(String executable) {
            arguments.add(new Argument(executable, false));
        }

        public Builder arg(String value) {
            arguments.add(new Argument(value, false));
            return this;
        }

        public Builder option(String name, String value) {
            return arg(name).arg(value);
        }

        public Builder quotedOption(String name, String value) {
            arguments.add(new Argument(name, false));
            arguments.add(new Argument(value, true));
            return this;
        }

        public Builder workingDirectory(Path dir) {
            this.workingDirectory = dir;
            return this;
        }

        public ContainerCommand build() {
            if (workingDirectory == null) {
                throw new IllegalStateException("workingDirectory is required");
            }
            return new ContainerCommand(arguments, workingDirectory);
        }
    }
}
