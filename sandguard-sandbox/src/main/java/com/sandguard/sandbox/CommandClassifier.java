package com.sandguard.sandbox;

import com.sandguard.common.security.AuditSink;
import com.sandguard.common.security.SecurityAuditTypes.AuditEvent;
import com.sandguard.common.security.SecurityAuditTypes.Severity;
import com.sandguard.sandbox.InjectionDetector.Detection;
import com.sandguard.sandbox.SandboxTypes.ClassificationResult;
import com.sandguard.sandbox.SandboxTypes.ResolvedPolicy;
import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies shell commands against a resolved policy.
 * <p>
 * Order of evaluation: empty guard, circuit breaker, built-in injection
 * detection, {@code blocked_paths}, {@code blocked_patterns}, safe commands,
 * and finally NEEDS_APPROVAL. Every call records exactly one audit event; the
 * call that trips the breaker records a second one at ERROR.
 */
@Slf4j
public class CommandClassifier {

    public static final String OP_CLASSIFY = "sandbox_classify";
    public static final String OP_CIRCUIT_BREAKER = "sandbox_circuit_breaker";

    static final String REASON_EMPTY = "Empty command";
    static final String REASON_UNKNOWN = "Unknown command, not in safe or blocked lists";

    private record CompiledPattern(String source, Pattern pattern) {
    }

    private final ResolvedPolicy policy;
    private final boolean canSandbox;
    private final AuditSink auditSink;
    private final CircuitBreaker circuitBreaker;
    private final List<CompiledPattern> blockedPatterns;
    private final List<CompiledPattern> blockedPaths;

    public CommandClassifier(ResolvedPolicy policy, ResolvedSandboxBinary binary, AuditSink auditSink) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.canSandbox = policy.sandboxEnabled() && binary != null && binary.isAvailable();
        this.circuitBreaker = new CircuitBreaker(policy.circuitBreaker());
        this.blockedPatterns = compilePatterns(policy.blockedPatterns());
        this.blockedPaths = compileGlobs(policy.blockedPaths());
    }

    // =========================================================================
    // Classification
    // =========================================================================

    /**
     * Classify one command. Never throws; a null command counts as empty.
     */
    public ClassificationResult classify(String command) {
        ClassificationResult result = evaluate(command);
        audit(command, result);
        return result;
    }

    private ClassificationResult evaluate(String command) {
        if (command == null || command.isBlank()) {
            return ClassificationResult.needsApproval(REASON_EMPTY, true);
        }
        String trimmed = command.strip();

        Optional<String> blockReason = findBlockReason(trimmed);

        if (circuitBreaker.isTripped()) {
            if (blockReason.isEmpty() && matchesSafeCommand(trimmed)) {
                log.info("Safe command closes open circuit breaker after {} blocks",
                        circuitBreaker.getConsecutiveBlocked());
                circuitBreaker.recordSafe();
                return ClassificationResult.safe(canSandbox);
            }
            // Rule hits keep counting while open; the trip event fired once already
            if (blockReason.isPresent()) {
                circuitBreaker.recordBlocked();
            }
            return ClassificationResult.blocked(breakerReason());
        }

        if (blockReason.isPresent()) {
            if (circuitBreaker.recordBlocked()) {
                onTrip(command);
            }
            return ClassificationResult.blocked(blockReason.get());
        }

        if (matchesSafeCommand(trimmed)) {
            circuitBreaker.recordSafe();
            return ClassificationResult.safe(canSandbox);
        }
        return ClassificationResult.needsApproval(REASON_UNKNOWN, canSandbox);
    }

    /**
     * Built-in detection first, then profile paths, then profile patterns.
     */
    private Optional<String> findBlockReason(String command) {
        Optional<Detection> detection = InjectionDetector.detect(command);
        if (detection.isPresent()) {
            return Optional.of(detection.get().reason());
        }
        for (CompiledPattern path : blockedPaths) {
            if (path.pattern().matcher(command).find()) {
                return Optional.of("Blocked path detected: " + path.source());
            }
        }
        for (CompiledPattern pattern : blockedPatterns) {
            if (pattern.pattern().matcher(command).find()) {
                return Optional.of("Matched blocked pattern: " + pattern.source());
            }
        }
        return Optional.empty();
    }

    /**
     * Exact match, or the entry followed by whitespace: {@code git status}
     * matches {@code git status --short} but not {@code git statusx}.
     */
    private boolean matchesSafeCommand(String command) {
        for (String safe : policy.safeCommands()) {
            if (safe == null || safe.isBlank()) {
                continue;
            }
            String entry = safe.strip();
            if (command.equals(entry)) {
                return true;
            }
            if (command.startsWith(entry) && Character.isWhitespace(command.charAt(entry.length()))) {
                return true;
            }
        }
        return false;
    }

    private String breakerReason() {
        return "Blocked by circuit breaker: " + circuitBreaker.getConsecutiveBlocked()
                + " consecutive blocked commands (threshold " + circuitBreaker.getThreshold() + ")";
    }

    private void onTrip(String command) {
        String reason = "Circuit breaker tripped after " + circuitBreaker.getConsecutiveBlocked()
                + " consecutive blocked commands";
        log.error("{} (profile: {})", reason, policy.profileName());
        auditSink.record(AuditEvent.now(OP_CIRCUIT_BREAKER, command, Severity.ERROR, reason,
                policy.profileName()));
    }

    private void audit(String command, ClassificationResult result) {
        Severity severity = result.isBlocked() ? Severity.WARN : Severity.INFO;
        if (result.isBlocked()) {
            log.warn("Blocked command: {}", result.reason());
        } else {
            log.debug("Classified {} as {}", command, result.classification());
        }
        auditSink.record(AuditEvent.now(OP_CLASSIFY, command, severity, result.reason(),
                policy.profileName()));
    }

    // =========================================================================
    // Pattern compilation
    // =========================================================================

    /**
     * Policy patterns are case-insensitive regexes; an entry that is not a
     * valid regex matches as a literal.
     */
    private static List<CompiledPattern> compilePatterns(List<String> sources) {
        List<CompiledPattern> compiled = new ArrayList<>();
        for (String source : sources) {
            if (source == null || source.isEmpty()) {
                continue;
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(source, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid blocked pattern '{}', matching it literally: {}", source, e.getDescription());
                pattern = Pattern.compile(Pattern.quote(source), Pattern.CASE_INSENSITIVE);
            }
            compiled.add(new CompiledPattern(source, pattern));
        }
        return compiled;
    }

    /**
     * Path entries are substrings; {@code *} and {@code ?} act as globs.
     */
    private static List<CompiledPattern> compileGlobs(List<String> sources) {
        List<CompiledPattern> compiled = new ArrayList<>();
        for (String source : sources) {
            if (source == null || source.isEmpty()) {
                continue;
            }
            StringBuilder regex = new StringBuilder();
            StringBuilder literal = new StringBuilder();
            for (char c : source.toCharArray()) {
                if (c == '*' || c == '?') {
                    if (literal.length() > 0) {
                        regex.append(Pattern.quote(literal.toString()));
                        literal.setLength(0);
                    }
                    regex.append(c == '*' ? "\\S*" : "\\S");
                } else {
                    literal.append(c);
                }
            }
            if (literal.length() > 0) {
                regex.append(Pattern.quote(literal.toString()));
            }
            compiled.add(new CompiledPattern(source, Pattern.compile(regex.toString())));
        }
        return compiled;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
