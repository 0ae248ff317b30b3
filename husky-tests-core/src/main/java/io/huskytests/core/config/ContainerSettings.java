package io.huskytests.core.config;

/**
 * Names and paths used when tests are executed inside a container.
 *
 * <p>Passed to the container runner at construction so that every invocation
 * is fully determined by this value.
 *
 * @param runtime                  container runtime executable, e.g. {@code docker}
 * @param imageName                tag given to the built test image
 * @param containerName            name of the launched test container
 * @param networkName              network the test container joins
 * @param hostResultFolder         folder under the assembly directory receiving result files
 * @param containerResultDirectory mount point of the result folder inside the container
 * @param resultPathOption         run setting telling the contained runner where to write results
 */
public record ContainerSettings(
        String runtime,
        String imageName,
        String containerName,
        String networkName,
        String hostResultFolder,
        String containerResultDirectory,
        String resultPathOption
) {

    public ContainerSettings {
        requireText(runtime, "runtime");
        requireText(imageName, "imageName");
        requireText(containerName, "containerName");
        requireText(networkName, "networkName");
        requireText(hostResultFolder, "hostResultFolder");
        requireText(containerResultDirectory, "containerResultDirectory");
        requireText(resultPathOption, "resultPathOption");
        if (hostResultFolder.contains("..")) {
            throw new IllegalArgumentException("hostResultFolder must stay inside the assembly directory: " + hostResultFolder);
        }
    }

    /** Settings with the stock docker names. */
    public static ContainerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    public static final class Builder {
        private String runtime = "docker";
        private String imageName = "husky-test-image";
        private String containerName = "husky-test-runner";
        private String networkName = "husky-test-network";
        private String hostResultFolder = "husky_test_results";
        private String containerResultDirectory = "/husky_test_results";
        private String resultPathOption = "Husky.TestOutputXml";

        public Builder runtime(String v) { this.runtime = v; return this; }
        public Builder imageName(String v) { this.imageName = v; return this; }
        public Builder containerName(String v) { this.containerName = v; return this; }
        public Builder networkName(String v) { this.networkName = v; return this; }
        public Builder hostResultFolder(String v) { this.hostResultFolder = v; return this; }
        public Builder containerResultDirectory(String v) { this.containerResultDirectory = v; return this; }
        public Builder resultPathOption(String v) { this.resultPathOption = v; return this; }

        public ContainerSettings build() {
            return new ContainerSettings(runtime, imageName, containerName, networkName,
                    hostResultFolder, containerResultDirectory, resultPathOption);
        }
    }
}
