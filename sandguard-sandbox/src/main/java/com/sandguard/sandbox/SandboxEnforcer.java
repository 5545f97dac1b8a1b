package com.sandguard.sandbox;

import com.sandguard.common.security.AuditSink;
import com.sandguard.common.security.LoggingAuditSink;
import com.sandguard.sandbox.SandboxTypes.Boundaries;
import com.sandguard.sandbox.SandboxTypes.ClassificationResult;
import com.sandguard.sandbox.SandboxTypes.ResolvedPolicy;
import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;
import com.sandguard.sandbox.SandboxTypes.SandboxBinary;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Policy-driven gatekeeper for shell commands.
 * <p>
 * The policy, profile and sandbox binary are resolved once at construction;
 * after that the enforcer only classifies commands and wraps the ones the
 * caller decides to run:
 *
 * <pre>{@code
 * SandboxEnforcer enforcer = new SandboxEnforcer();
 * ClassificationResult result = enforcer.classify("git status --short");
 * if (result.isSafe()) {
 *     new ProcessBuilder(enforcer.buildSandboxArgs("git status --short", boundaries)).start();
 * }
 * }</pre>
 *
 * Instances are not thread-safe; the circuit breaker belongs to the instance.
 */
@Slf4j
public class SandboxEnforcer {

    private final ResolvedPolicy policy;
    private final ResolvedSandboxBinary sandboxBinary;
    private final CommandClassifier classifier;
    private final SandboxArgsBuilder argsBuilder;

    /**
     * Enforcer for the current environment and working directory, using the
     * policy cascade.
     */
    public SandboxEnforcer() {
        this(null, null, null, null, null, null, null, null);
    }

    /**
     * @param policyPath explicit policy file, or null for the cascade
     * @param profile    profile name, or null for {@code SANDBOX_PROFILE}
     * @throws PolicyValidationException if {@code policyPath} exists and is invalid
     */
    public SandboxEnforcer(Path policyPath, String profile) {
        this(policyPath, profile, null, null, null, null, null, null);
    }

    @Builder
    private SandboxEnforcer(Path policyPath,
            String profile,
            Map<String, String> environment,
            Path projectRoot,
            SandboxBinaryResolver binaryResolver,
            AuditSink auditSink,
            PolicyStore policyStore,
            SeatbeltProfile seatbeltProfile) {
        EnforcerSettings settings = EnforcerSettings.resolve(
                profile,
                environment != null ? environment : System.getenv(),
                projectRoot);
        PolicyStore store = policyStore != null ? policyStore : PolicyStore.shared();
        this.policy = store.load(policyPath, settings);

        SandboxBinaryResolver resolver = binaryResolver != null
                ? binaryResolver
                : SandboxBinaryResolvers.forCurrentPlatform();
        this.sandboxBinary = resolver.resolve();

        this.classifier = new CommandClassifier(policy, sandboxBinary,
                auditSink != null ? auditSink : new LoggingAuditSink());
        this.argsBuilder = new SandboxArgsBuilder(sandboxBinary,
                seatbeltProfile != null
                        ? seatbeltProfile
                        : new SeatbeltProfile(Path.of(System.getProperty("java.io.tmpdir"), "sandguard")));

        log.info("Sandbox enforcer ready: profile={}, source={}, binary={}, sandboxEnabled={}",
                policy.profileName(), policy.source(), sandboxBinary.binary(), policy.sandboxEnabled());
    }

    // ── Classification ──────────────────────────────────────────────

    public ClassificationResult classify(String command) {
        return classifier.classify(command);
    }

    // ── Wrapping ────────────────────────────────────────────────────

    /**
     * Argument vector that runs {@code command} inside the sandbox. When
     * sandboxing is disabled by policy or {@code SANDBOX_ENABLED}, the command
     * words are returned unwrapped.
     */
    public List<String> buildSandboxArgs(String command, Boundaries boundaries) {
        if (!policy.sandboxEnabled()) {
            return ShellWords.split(command);
        }
        return argsBuilder.build(command, boundaries);
    }

    // ── State ───────────────────────────────────────────────────────

    public SandboxBinary getSandboxBinary() {
        return sandboxBinary.binary();
    }

    public ResolvedSandboxBinary getResolvedSandboxBinary() {
        return sandboxBinary;
    }

    public ResolvedPolicy getPolicy() {
        return policy;
    }

    public String getActiveProfile() {
        return policy.profileName();
    }

    public int getConsecutiveBlocked() {
        return classifier.getCircuitBreaker().getConsecutiveBlocked();
    }

    public boolean isCircuitBreakerTripped() {
        return classifier.getCircuitBreaker().isTripped();
    }

    /**
     * Schema check for one profile document.
     */
    public static boolean validatePolicy(Map<String, Object> profileDocument) {
        return PolicyStore.validate(profileDocument);
    }
}
