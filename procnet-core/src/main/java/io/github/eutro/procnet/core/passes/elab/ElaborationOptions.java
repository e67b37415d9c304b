package io.github.eutro.procnet.core.passes.elab;

/**
 * Settings for {@link ProcElaboration}.
 */
public final class ElaborationOptions {
    /**
     * The default options.
     */
    public static final ElaborationOptions DEFAULT = builder().build();

    private final int maxSpawnDepth;
    private final boolean detectRecursion;
    private final String suffixSeparator;

    private ElaborationOptions(Builder builder) {
        maxSpawnDepth = builder.maxSpawnDepth;
        detectRecursion = builder.detectRecursion;
        suffixSeparator = builder.suffixSeparator;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the deepest a spawn tree may nest, counting the root as depth 1.
     *
     * @return The maximum depth.
     */
    public int getMaxSpawnDepth() {
        return maxSpawnDepth;
    }

    /**
     * Get whether a template spawning itself, directly or indirectly, is reported
     * as soon as it happens, rather than when the depth limit is reached.
     *
     * @return Whether recursion is detected.
     */
    public boolean isDetectRecursion() {
        return detectRecursion;
    }

    /**
     * Get the string placed between a name and the number that makes it unique.
     *
     * @return The separator.
     */
    public String getSuffixSeparator() {
        return suffixSeparator;
    }

    public static final class Builder {
        private int maxSpawnDepth = 1024;
        private boolean detectRecursion = true;
        private String suffixSeparator = "_";

        private Builder() {
        }

        public Builder setMaxSpawnDepth(int maxSpawnDepth) {
            if (maxSpawnDepth < 1) {
                throw new IllegalArgumentException("maxSpawnDepth must be positive, got " + maxSpawnDepth);
            }
            this.maxSpawnDepth = maxSpawnDepth;
            return this;
        }

        public Builder setDetectRecursion(boolean detectRecursion) {
            this.detectRecursion = detectRecursion;
            return this;
        }

        public Builder setSuffixSeparator(String suffixSeparator) {
            if (suffixSeparator.isEmpty()) {
                throw new IllegalArgumentException("suffixSeparator must not be empty");
            }
            this.suffixSeparator = suffixSeparator;
            return this;
        }

        public ElaborationOptions build() {
            return new ElaborationOptions(this);
        }
    }
}
