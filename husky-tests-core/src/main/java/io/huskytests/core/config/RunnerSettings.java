package io.huskytests.core.config;

/**
 * Settings that drive strategy selection and filter reconciliation.
 * Immutable value object — use the {@link Builder} to construct.
 */
public final class RunnerSettings {

    private final boolean designMode;
    private final DiscoveryMethod discoveryMethod;
    private final boolean useNativeFilter;
    private final int assemblySelectLimit;
    private final String testOutputXmlFolder;
    private final boolean dumpXmlTestResults;

    private RunnerSettings(Builder builder) {
        this.designMode = builder.designMode;
        this.discoveryMethod = builder.discoveryMethod;
        this.useNativeFilter = builder.useNativeFilter;
        this.assemblySelectLimit = builder.assemblySelectLimit;
        this.testOutputXmlFolder = builder.testOutputXmlFolder;
        this.dumpXmlTestResults = builder.dumpXmlTestResults;
    }

    /** True when invoked interactively from a development environment. */
    public boolean designMode() { return designMode; }
    public DiscoveryMethod discoveryMethod() { return discoveryMethod; }
    /** True when the caller's filter expression is handed to the engine as-is. */
    public boolean useNativeFilter() { return useNativeFilter; }
    public int assemblySelectLimit() { return assemblySelectLimit; }
    public String testOutputXmlFolder() { return testOutputXmlFolder; }
    public boolean dumpXmlTestResults() { return dumpXmlTestResults; }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RunnerSettings{designMode=" + designMode
                + ", discoveryMethod=" + discoveryMethod
                + ", useNativeFilter=" + useNativeFilter
                + ", assemblySelectLimit=" + assemblySelectLimit
                + ", testOutputXmlFolder='" + testOutputXmlFolder + '\''
                + ", dumpXmlTestResults=" + dumpXmlTestResults + '}';
    }

    public static final class Builder {
        private boolean designMode = false;
        private DiscoveryMethod discoveryMethod = DiscoveryMethod.CURRENT;
        private boolean useNativeFilter = false;
        private int assemblySelectLimit = 2000;
        private String testOutputXmlFolder = "TestResults";
        private boolean dumpXmlTestResults = false;

        public Builder designMode(boolean v) { this.designMode = v; return this; }
        public Builder useNativeFilter(boolean v) { this.useNativeFilter = v; return this; }
        public Builder assemblySelectLimit(int v) { this.assemblySelectLimit = Math.max(1, v); return this; }
        public Builder dumpXmlTestResults(boolean v) { this.dumpXmlTestResults = v; return this; }

        public Builder discoveryMethod(DiscoveryMethod v) {
            if (v == null) {
                throw new IllegalArgumentException("discoveryMethod must not be null");
            }
            this.discoveryMethod = v;
            return this;
        }

        public Builder testOutputXmlFolder(String v) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("testOutputXmlFolder must not be null or blank");
            }
            this.testOutputXmlFolder = v;
            return this;
        }

        public RunnerSettings build() {
            return new RunnerSettings(this);
        }
    }
}
