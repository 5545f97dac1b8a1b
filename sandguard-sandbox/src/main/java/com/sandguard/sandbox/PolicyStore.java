package com.sandguard.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandguard.common.infra.Hashing;
import com.sandguard.sandbox.SandboxTypes.PolicySource;
import com.sandguard.sandbox.SandboxTypes.ProfileConfig;
import com.sandguard.sandbox.SandboxTypes.ResolvedPolicy;
import com.sandguard.sandbox.SandboxTypes.SandboxPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads, validates and resolves sandbox policies.
 * <p>
 * Resolution order when no explicit path is given:
 * <ol>
 * <li>{@code <project-root>/.claude/sandbox_policy.json}</li>
 * <li>{@code <project-root>/.claude/config/sandbox_policy.json}</li>
 * <li>the default policy bundled on the classpath</li>
 * </ol>
 * Only an explicitly supplied file that exists but fails schema validation is
 * an error; every other miss degrades to the bundled default.
 */
@Slf4j
public class PolicyStore {

    public static final String POLICY_FILENAME = "sandbox_policy.json";
    static final String BUNDLED_RESOURCE = "default_sandbox_policy.json";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };
    private static final PolicyStore SHARED = new PolicyStore();

    private final ObjectMapper objectMapper;
    private final Cache<DocumentKey, Map<String, Object>> documents;

    /** Identity of a policy file revision: its location and a hash of its bytes. */
    private record DocumentKey(Path path, String contentHash) {
    }

    public PolicyStore() {
        this(DEFAULT_CACHE_TTL);
    }

    public PolicyStore(Duration cacheTtl) {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.documents = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(64)
                .build();
    }

    /**
     * Process-wide store, so enforcers created per workflow share parsed
     * documents. Files are read on every load; only the parse is cached.
     */
    public static PolicyStore shared() {
        return SHARED;
    }

    // =========================================================================
    // Load
    // =========================================================================

    /**
     * Load and resolve the policy for the given settings.
     *
     * @param explicitPath caller-supplied policy file, or null for cascade
     *                     resolution
     * @throws PolicyValidationException if {@code explicitPath} exists, parses,
     *                                   and fails schema validation
     */
    public ResolvedPolicy load(Path explicitPath, EnforcerSettings settings) {
        if (explicitPath != null) {
            Optional<Map<String, Object>> document = readDocument(explicitPath);
            if (document.isEmpty()) {
                log.info("Sandbox policy {} not usable, using bundled default", explicitPath);
                return loadBundled(settings);
            }
            return resolve(document.get(), settings, PolicySource.EXPLICIT, explicitPath);
        }

        for (Candidate candidate : cascadeCandidates(settings.projectRoot())) {
            Optional<Map<String, Object>> document = readDocument(candidate.path());
            if (document.isEmpty()) {
                continue;
            }
            try {
                return resolve(document.get(), settings, candidate.source(), candidate.path());
            } catch (PolicyValidationException e) {
                log.warn("Skipping sandbox policy {}: {}", candidate.path(), e.getMessage());
            }
        }
        return loadBundled(settings);
    }

    /**
     * A cascade location and the source it maps to.
     */
    public record Candidate(Path path, PolicySource source) {
    }

    /**
     * Project-local policy locations in priority order.
     */
    public static List<Candidate> cascadeCandidates(Path projectRoot) {
        Path claudeDir = projectRoot.resolve(".claude");
        return List.of(
                new Candidate(claudeDir.resolve(POLICY_FILENAME), PolicySource.PROJECT_ROOT),
                new Candidate(claudeDir.resolve("config").resolve(POLICY_FILENAME), PolicySource.PROJECT_CONFIG));
    }

    /**
     * Drop every cached policy document.
     */
    public void invalidate() {
        documents.invalidateAll();
    }

    // =========================================================================
    // Validation
    // =========================================================================

    /**
     * Check the required fields of one profile document: {@code safe_commands}
     * and {@code blocked_patterns} must be lists and {@code sandbox_enabled}
     * must be present as a boolean. Optional fields and list items are checked
     * by {@link #validateProfile} when a policy is loaded.
     */
    public static boolean validate(Map<String, Object> profileDocument) {
        return profileDocument != null
                && profileDocument.get("safe_commands") instanceof List<?>
                && profileDocument.get("blocked_patterns") instanceof List<?>
                && profileDocument.get("sandbox_enabled") instanceof Boolean;
    }

    /**
     * Validate a whole policy document.
     *
     * @return the dotted path of the first invalid field, or empty if valid
     */
    public static Optional<String> validateDocument(Map<String, Object> document) {
        if (document == null || !(document.get("profiles") instanceof Map<?, ?> profiles)) {
            return Optional.of("profiles");
        }
        for (Map.Entry<?, ?> entry : profiles.entrySet()) {
            String prefix = "profiles." + entry.getKey();
            if (!(entry.getValue() instanceof Map<?, ?> profile)) {
                return Optional.of(prefix);
            }
            Optional<String> problem = validateProfile(profile);
            if (problem.isPresent()) {
                return Optional.of(prefix + "." + problem.get());
            }
        }
        Object defaultProfile = document.get("default_profile");
        if (defaultProfile != null
                && (!(defaultProfile instanceof String name) || !profiles.containsKey(name))) {
            return Optional.of("default_profile");
        }
        Object version = document.get("version");
        if (version != null && !(version instanceof String)) {
            return Optional.of("version");
        }
        return Optional.empty();
    }

    /**
     * Validate one profile.
     *
     * @return the name of the first invalid field, or empty if valid
     */
    public static Optional<String> validateProfile(Map<?, ?> profile) {
        if (!isStringList(profile.get("safe_commands"))) {
            return Optional.of("safe_commands");
        }
        if (!isStringList(profile.get("blocked_patterns"))) {
            return Optional.of("blocked_patterns");
        }
        if (!(profile.get("sandbox_enabled") instanceof Boolean)) {
            return Optional.of("sandbox_enabled");
        }
        Object blockedPaths = profile.get("blocked_paths");
        if (blockedPaths != null && !isStringList(blockedPaths)) {
            return Optional.of("blocked_paths");
        }
        Object breaker = profile.get("circuit_breaker");
        if (breaker != null) {
            if (!(breaker instanceof Map<?, ?> cb)) {
                return Optional.of("circuit_breaker");
            }
            Object enabled = cb.get("enabled");
            if (enabled != null && !(enabled instanceof Boolean)) {
                return Optional.of("circuit_breaker.enabled");
            }
            Object threshold = cb.get("threshold");
            if (threshold != null && !(threshold instanceof Integer t && t > 0)) {
                return Optional.of("circuit_breaker.threshold");
            }
        }
        return Optional.empty();
    }

    private static boolean isStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return false;
        }
        return list.stream().allMatch(item -> item instanceof String);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private ResolvedPolicy resolve(Map<String, Object> document, EnforcerSettings settings,
            PolicySource source, Path path) {
        validateDocument(document).ifPresent(field -> {
            throw new PolicyValidationException(field, path);
        });

        SandboxPolicy policy = objectMapper.convertValue(document, SandboxPolicy.class);
        String requested = settings.profile();
        String active = requested;
        ProfileConfig profile = requested != null ? policy.getProfiles().get(requested) : null;
        if (profile == null) {
            active = policy.getDefaultProfile() != null
                    ? policy.getDefaultProfile()
                    : EnforcerSettings.DEFAULT_PROFILE;
            profile = policy.getProfiles().get(active);
            if (profile == null) {
                throw new PolicyValidationException("default_profile", path);
            }
            log.debug("Sandbox profile '{}' not found, falling back to '{}'", requested, active);
        }

        boolean sandboxEnabled = profile.isSandboxEnabled() && settings.sandboxEnabled();
        log.info("Sandbox policy loaded from {} (profile: {})",
                path != null ? path : "bundled default", active);
        return ResolvedPolicy.of(active, profile, sandboxEnabled, source, path);
    }

    private ResolvedPolicy loadBundled(EnforcerSettings settings) {
        try (InputStream in = PolicyStore.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled sandbox policy missing: " + BUNDLED_RESOURCE);
            }
            Map<String, Object> document = objectMapper.readValue(in, DOCUMENT_TYPE);
            return resolve(document, settings, PolicySource.BUNDLED_DEFAULT, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled sandbox policy", e);
        }
    }

    /**
     * Read a policy file. Missing and unparseable files yield empty.
     */
    private Optional<Map<String, Object>> readDocument(Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("Sandbox policy not found: {}", path);
            return Optional.empty();
        }
        Path absolute = path.toAbsolutePath().normalize();
        String raw;
        try {
            raw = Files.readString(absolute);
        } catch (IOException e) {
            log.warn("Failed to read sandbox policy {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        DocumentKey key = new DocumentKey(absolute, Hashing.sha256Hex(raw));
        return Optional.ofNullable(documents.get(key, k -> parse(k, raw)));
    }

    private Map<String, Object> parse(DocumentKey key, String raw) {
        try {
            Object parsed = objectMapper.readValue(raw, Object.class);
            if (parsed instanceof Map<?, ?>) {
                @SuppressWarnings("unchecked")
                Map<String, Object> document = (Map<String, Object>) parsed;
                return document;
            }
            // Parseable but not an object; hand it to validation so it names "profiles"
            return Map.of();
        } catch (IOException e) {
            log.warn("Corrupt sandbox policy {}, ignoring: {}", key.path(), e.getMessage());
            return null;
        }
    }
}
