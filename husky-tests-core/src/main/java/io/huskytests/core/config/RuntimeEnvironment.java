package io.huskytests.core.config;

/**
 * Read access to process environment variables.
 */
@FunctionalInterface
public interface RuntimeEnvironment {

    /** Environment variable set to {@value #IN_CONTAINER_SENTINEL} inside the test container. */
    String IN_CONTAINER_VARIABLE = "HUSKY_RUNNING_IN_CONTAINER";
    String IN_CONTAINER_SENTINEL = "true";

    /**
     * @return the value of the variable, or {@code null} when unset
     */
    String getenv(String name);

    default boolean isInContainer() {
        return IN_CONTAINER_SENTINEL.equals(getenv(IN_CONTAINER_VARIABLE));
    }

    static RuntimeEnvironment system() {
        return System::getenv;
    }
}
