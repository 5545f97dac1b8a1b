package com.sandguard.sandbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Core sandbox type definitions: the policy document, classification results,
 * sandbox binaries and filesystem/network boundaries.
 */
public final class SandboxTypes {

    private SandboxTypes() {
    }

    // ── Classification ──────────────────────────────────────────────

    public enum CommandClassification {
        /** Trusted; may run without a prompt. */
        SAFE,
        /** Denied; never run. */
        BLOCKED,
        /** Unknown; a human has to approve it. */
        NEEDS_APPROVAL
    }

    /**
     * Outcome of classifying one command. {@code reason} is always present for
     * BLOCKED, absent for SAFE.
     */
    public record ClassificationResult(
            CommandClassification classification,
            String reason,
            boolean canSandbox) {

        public ClassificationResult {
            Objects.requireNonNull(classification, "classification");
        }

        public static ClassificationResult safe(boolean canSandbox) {
            return new ClassificationResult(CommandClassification.SAFE, null, canSandbox);
        }

        public static ClassificationResult blocked(String reason) {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("BLOCKED result requires a reason");
            }
            return new ClassificationResult(CommandClassification.BLOCKED, reason, false);
        }

        public static ClassificationResult needsApproval(String reason, boolean canSandbox) {
            return new ClassificationResult(CommandClassification.NEEDS_APPROVAL, reason, canSandbox);
        }

        public boolean isSafe() {
            return classification == CommandClassification.SAFE;
        }

        public boolean isBlocked() {
            return classification == CommandClassification.BLOCKED;
        }
    }

    // ── Sandbox binaries ────────────────────────────────────────────

    public enum SandboxBinary {
        /** Linux bubblewrap. */
        BWRAP("bwrap"),
        /** macOS Seatbelt launcher. */
        SANDBOX_EXEC("sandbox-exec"),
        /** No usable wrapper (Windows, other platforms, or binary missing). */
        NONE(null);

        private final String executableName;

        SandboxBinary(String executableName) {
            this.executableName = executableName;
        }

        public String getExecutableName() {
            return executableName;
        }
    }

    /**
     * A sandbox binary together with the absolute path it was found at.
     */
    public record ResolvedSandboxBinary(SandboxBinary binary, String path) {

        public static final ResolvedSandboxBinary NONE = new ResolvedSandboxBinary(SandboxBinary.NONE, null);

        public ResolvedSandboxBinary {
            Objects.requireNonNull(binary, "binary");
            if (binary != SandboxBinary.NONE && (path == null || path.isBlank())) {
                throw new IllegalArgumentException(binary + " requires an executable path");
            }
        }

        public boolean isAvailable() {
            return binary != SandboxBinary.NONE;
        }
    }

    // ── Boundaries ──────────────────────────────────────────────────

    /**
     * Filesystem and network envelope for one sandboxed invocation.
     *
     * @param readOnly  paths bound read-only, in order
     * @param readWrite paths bound read-write, in order
     * @param network   whether network access is permitted
     */
    public record Boundaries(List<String> readOnly, List<String> readWrite, boolean network) {

        public Boundaries {
            readOnly = readOnly == null ? List.of() : List.copyOf(readOnly);
            readWrite = readWrite == null ? List.of() : List.copyOf(readWrite);
        }

        /** No bind mounts, no network. */
        public static Boundaries none() {
            return new Boundaries(List.of(), List.of(), false);
        }
    }

    // ── Policy document ─────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CircuitBreakerConfig {
        @Builder.Default
        private boolean enabled = true;
        @Builder.Default
        private int threshold = CircuitBreaker.DEFAULT_THRESHOLD;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProfileConfig {
        @JsonProperty("safe_commands")
        private List<String> safeCommands;
        @JsonProperty("blocked_patterns")
        private List<String> blockedPatterns;
        @JsonProperty("blocked_paths")
        private List<String> blockedPaths;
        @JsonProperty("sandbox_enabled")
        private boolean sandboxEnabled;
        @JsonProperty("circuit_breaker")
        private CircuitBreakerConfig circuitBreaker;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SandboxPolicy {
        private String version;
        private Map<String, ProfileConfig> profiles;
        @JsonProperty("default_profile")
        private String defaultProfile;
    }

    // ── Resolved view ───────────────────────────────────────────────

    public enum PolicySource {
        /** Caller-supplied policy path. */
        EXPLICIT,
        /** {@code <root>/.claude/sandbox_policy.json}. */
        PROJECT_ROOT,
        /** {@code <root>/.claude/config/sandbox_policy.json}. */
        PROJECT_CONFIG,
        /** Policy shipped on the classpath. */
        BUNDLED_DEFAULT
    }

    /**
     * The flattened, profile-resolved policy one enforcer classifies against.
     * Lists are immutable copies taken at load time.
     *
     * @param profileName      the profile actually in use (after fallback)
     * @param safeCommands     trusted command prefixes
     * @param blockedPatterns  case-insensitive regexes that block a command
     * @param blockedPaths     path globs that block a command
     * @param breakerEnabled   whether the circuit breaker may trip
     * @param breakerThreshold consecutive blocks that trip the breaker
     * @param sandboxEnabled   profile flag combined with the environment override
     * @param source           where the policy came from
     * @param sourcePath       file the policy was read from, null for the bundled default
     */
    public record ResolvedPolicy(
            String profileName,
            List<String> safeCommands,
            List<String> blockedPatterns,
            List<String> blockedPaths,
            boolean breakerEnabled,
            int breakerThreshold,
            boolean sandboxEnabled,
            PolicySource source,
            Path sourcePath) {

        public ResolvedPolicy {
            Objects.requireNonNull(profileName, "profileName");
            Objects.requireNonNull(source, "source");
            safeCommands = safeCommands != null ? List.copyOf(safeCommands) : List.of();
            blockedPatterns = blockedPatterns != null ? List.copyOf(blockedPatterns) : List.of();
            blockedPaths = blockedPaths != null ? List.copyOf(blockedPaths) : List.of();
        }

        /**
         * Snapshot one profile of a bound policy document.
         */
        public static ResolvedPolicy of(String profileName, ProfileConfig profile, boolean sandboxEnabled,
                PolicySource source, Path sourcePath) {
            Objects.requireNonNull(profile, "profile");
            CircuitBreakerConfig breaker = profile.getCircuitBreaker() != null
                    ? profile.getCircuitBreaker()
                    : CircuitBreakerConfig.builder().build();
            return new ResolvedPolicy(profileName,
                    profile.getSafeCommands(),
                    profile.getBlockedPatterns(),
                    profile.getBlockedPaths(),
                    breaker.isEnabled(),
                    breaker.getThreshold(),
                    sandboxEnabled,
                    source,
                    sourcePath);
        }

        /**
         * A fresh breaker configuration; changing it does not affect this policy.
         */
        public CircuitBreakerConfig circuitBreaker() {
            return CircuitBreakerConfig.builder()
                    .enabled(breakerEnabled)
                    .threshold(breakerThreshold)
                    .build();
        }
    }
}
