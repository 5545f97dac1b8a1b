package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.PolicySource;
import com.sandguard.sandbox.SandboxTypes.ResolvedPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PolicyStoreTest {

    private static final String VALID_POLICY = """
            {
              "version": "1.0.0",
              "default_profile": "development",
              "profiles": {
                "development": {
                  "safe_commands": ["cat", "git status"],
                  "blocked_patterns": ["rm -rf", "sudo"],
                  "sandbox_enabled": true,
                  "circuit_breaker": {"enabled": true, "threshold": 10}
                },
                "locked": {
                  "safe_commands": ["ls"],
                  "blocked_patterns": ["curl"],
                  "sandbox_enabled": false
                }
              }
            }
            """;

    @TempDir
    Path tempDir;

    private PolicyStore store;

    @BeforeEach
    void setUp() {
        store = new PolicyStore();
    }

    private EnforcerSettings settings(String profile) {
        return EnforcerSettings.resolve(profile, Map.of(), tempDir);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    class ExplicitPath {
        @Test
        void validFileLoads() throws IOException {
            Path file = write("policy.json", VALID_POLICY);
            ResolvedPolicy policy = store.load(file, settings("development"));

            assertEquals(PolicySource.EXPLICIT, policy.source());
            assertEquals(file, policy.sourcePath());
            assertEquals("development", policy.profileName());
            assertEquals(List.of("cat", "git status"), policy.safeCommands());
            assertEquals(List.of("rm -rf", "sudo"), policy.blockedPatterns());
            assertTrue(policy.blockedPaths().isEmpty());
            assertEquals(10, policy.circuitBreaker().getThreshold());
            assertTrue(policy.sandboxEnabled());
        }

        @Test
        void missingFileFallsBackToBundled() {
            ResolvedPolicy policy = store.load(tempDir.resolve("absent.json"), settings("development"));
            assertEquals(PolicySource.BUNDLED_DEFAULT, policy.source());
            assertNull(policy.sourcePath());
            assertTrue(policy.safeCommands().contains("git status"));
        }

        @Test
        void corruptJsonFallsBackToBundled() throws IOException {
            Path file = write("policy.json", "{ not json");
            assertEquals(PolicySource.BUNDLED_DEFAULT, store.load(file, settings("development")).source());
        }

        @Test
        void missingProfilesIsInvalid() throws IOException {
            Path file = write("policy.json", "{\"version\": \"1.0.0\"}");
            PolicyValidationException e = assertThrows(PolicyValidationException.class,
                    () -> store.load(file, settings("development")));
            assertEquals("profiles", e.getField());
            assertEquals(file, e.getPolicyPath());
            assertTrue(e.getMessage().contains("profiles"));
        }

        @Test
        void nonObjectDocumentIsInvalid() throws IOException {
            Path file = write("policy.json", "[1, 2, 3]");
            PolicyValidationException e = assertThrows(PolicyValidationException.class,
                    () -> store.load(file, settings("development")));
            assertEquals("profiles", e.getField());
        }

        @Test
        void wrongFieldTypeNamesTheField() throws IOException {
            Path file = write("policy.json", """
                    {"profiles": {"development": {
                      "safe_commands": "cat",
                      "blocked_patterns": [],
                      "sandbox_enabled": true}}}
                    """);
            PolicyValidationException e = assertThrows(PolicyValidationException.class,
                    () -> store.load(file, settings("development")));
            assertEquals("profiles.development.safe_commands", e.getField());
        }

        @Test
        void defaultProfileMustExist() throws IOException {
            Path file = write("policy.json", """
                    {"default_profile": "ghost", "profiles": {"dev": {
                      "safe_commands": [], "blocked_patterns": [], "sandbox_enabled": true}}}
                    """);
            PolicyValidationException e = assertThrows(PolicyValidationException.class,
                    () -> store.load(file, settings("dev")));
            assertEquals("default_profile", e.getField());
        }
    }

    @Nested
    class ProfileSelection {
        @Test
        void unknownProfileFallsBackToDefault() throws IOException {
            Path file = write("policy.json", VALID_POLICY);
            assertEquals("development", store.load(file, settings("nonexistent")).profileName());
        }

        @Test
        void developmentUsedWhenNoDefaultProfileDeclared() throws IOException {
            Path file = write("policy.json", """
                    {"profiles": {
                      "development": {"safe_commands": ["ls"], "blocked_patterns": [], "sandbox_enabled": true},
                      "other": {"safe_commands": [], "blocked_patterns": [], "sandbox_enabled": true}}}
                    """);
            assertEquals("development", store.load(file, settings("missing")).profileName());
        }

        @Test
        void noUsableProfileIsInvalid() throws IOException {
            Path file = write("policy.json", """
                    {"profiles": {"other": {"safe_commands": [], "blocked_patterns": [], "sandbox_enabled": true}}}
                    """);
            PolicyValidationException e = assertThrows(PolicyValidationException.class,
                    () -> store.load(file, settings("missing")));
            assertEquals("default_profile", e.getField());
        }

        @Test
        void sandboxFlagCombinesProfileAndEnvironment() throws IOException {
            Path file = write("policy.json", VALID_POLICY);
            assertFalse(store.load(file, settings("locked")).sandboxEnabled());

            EnforcerSettings disabled = EnforcerSettings.resolve("development",
                    Map.of("SANDBOX_ENABLED", "false"), tempDir);
            assertFalse(store.load(file, disabled).sandboxEnabled());
        }

        @Test
        void bundledProfilesCarryTheirThresholds() {
            assertEquals(10, store.load(null, settings("development")).circuitBreaker().getThreshold());
            assertEquals(5, store.load(null, settings("testing")).circuitBreaker().getThreshold());
            assertEquals(3, store.load(null, settings("production")).circuitBreaker().getThreshold());
        }
    }

    @Nested
    class Cascade {
        @Test
        void projectRootBeatsConfigDirectory() throws IOException {
            write(".claude/sandbox_policy.json", VALID_POLICY);
            write(".claude/config/sandbox_policy.json", VALID_POLICY.replace("\"cat\", ", ""));

            ResolvedPolicy policy = store.load(null, settings("development"));
            assertEquals(PolicySource.PROJECT_ROOT, policy.source());
            assertTrue(policy.safeCommands().contains("cat"));
        }

        @Test
        void configDirectoryUsedWhenRootAbsent() throws IOException {
            Path file = write(".claude/config/sandbox_policy.json", VALID_POLICY);
            ResolvedPolicy policy = store.load(null, settings("development"));
            assertEquals(PolicySource.PROJECT_CONFIG, policy.source());
            assertEquals(file, policy.sourcePath());
        }

        @Test
        void invalidCascadeFileIsSkipped() throws IOException {
            write(".claude/sandbox_policy.json", "{\"profiles\": {}, \"default_profile\": 3}");
            write(".claude/config/sandbox_policy.json", VALID_POLICY);
            assertEquals(PolicySource.PROJECT_CONFIG, store.load(null, settings("development")).source());
        }

        @Test
        void bundledWhenNothingInProject() {
            assertEquals(PolicySource.BUNDLED_DEFAULT, store.load(null, settings("development")).source());
        }

        @Test
        void candidatesInPriorityOrder() {
            List<PolicyStore.Candidate> candidates = PolicyStore.cascadeCandidates(tempDir);
            assertEquals(tempDir.resolve(".claude/sandbox_policy.json"), candidates.get(0).path());
            assertEquals(tempDir.resolve(".claude/config/sandbox_policy.json"), candidates.get(1).path());
        }
    }

    @Test
    void rewrittenFileIsReread() throws IOException {
        Path file = write("policy.json", VALID_POLICY);
        assertTrue(store.load(file, settings("development")).safeCommands().contains("cat"));

        Files.writeString(file, VALID_POLICY.replace("\"cat\", ", ""));
        assertFalse(store.load(file, settings("development")).safeCommands().contains("cat"));
    }

    @Test
    void sameSizeRewriteWithRestoredTimestampIsReread() throws IOException {
        String template = """
                {"profiles": {"development": {
                  "safe_commands": [], "blocked_patterns": ["%s"], "sandbox_enabled": true}}}
                """;
        Path file = write("policy.json", template.formatted("curl"));
        FileTime stamp = Files.getLastModifiedTime(file);
        assertEquals(List.of("curl"), store.load(file, settings("development")).blockedPatterns());

        Files.writeString(file, template.formatted("wget"));
        Files.setLastModifiedTime(file, stamp);

        assertEquals(List.of("wget"), store.load(file, settings("development")).blockedPatterns());
    }

    @Test
    void invalidateKeepsLoadsWorking() throws IOException {
        Path file = write("policy.json", VALID_POLICY);
        store.load(file, settings("development"));
        store.invalidate();
        assertEquals(PolicySource.EXPLICIT, store.load(file, settings("development")).source());
    }

    @Test
    void resolvedListsAreSnapshots() throws IOException {
        Path file = write("policy.json", VALID_POLICY);
        ResolvedPolicy policy = store.load(file, settings("development"));

        assertThrows(UnsupportedOperationException.class, () -> policy.safeCommands().add("shutdown"));
        assertThrows(UnsupportedOperationException.class, () -> policy.blockedPaths().add("/tmp"));
        policy.circuitBreaker().setEnabled(false);
        assertTrue(policy.breakerEnabled());

        assertEquals(List.of("cat", "git status"), store.load(file, settings("development")).safeCommands());
    }

    @Nested
    class Validation {
        private Map<String, Object> profile() {
            Map<String, Object> doc = new HashMap<>();
            doc.put("safe_commands", List.of("ls"));
            doc.put("blocked_patterns", List.of("sudo"));
            doc.put("sandbox_enabled", true);
            return doc;
        }

        @Test
        void validProfile() {
            assertTrue(PolicyStore.validate(profile()));
        }

        @Test
        void rejectsMissingOrMistypedFields() {
            Map<String, Object> noSafe = profile();
            noSafe.remove("safe_commands");
            assertFalse(PolicyStore.validate(noSafe));

            Map<String, Object> patternsNotList = profile();
            patternsNotList.put("blocked_patterns", "sudo");
            assertFalse(PolicyStore.validate(patternsNotList));

            Map<String, Object> noFlag = profile();
            noFlag.remove("sandbox_enabled");
            assertFalse(PolicyStore.validate(noFlag));

            Map<String, Object> stringFlag = profile();
            stringFlag.put("sandbox_enabled", "yes");
            assertFalse(PolicyStore.validate(stringFlag));

            assertFalse(PolicyStore.validate(null));
        }

        @Test
        void circuitBreakerThresholdMustBePositive() {
            Map<String, Object> bad = profile();
            bad.put("circuit_breaker", Map.of("enabled", true, "threshold", 0));
            assertEquals(Optional.of("circuit_breaker.threshold"), PolicyStore.validateProfile(bad));

            Map<String, Object> doc = Map.of("profiles", Map.of("dev", bad));
            assertEquals(Optional.of("profiles.dev.circuit_breaker.threshold"), PolicyStore.validateDocument(doc));
        }

        @Test
        void blockedPathsMustBeStrings() {
            Map<String, Object> bad = profile();
            bad.put("blocked_paths", List.of("/etc", 3));
            assertEquals(Optional.of("blocked_paths"), PolicyStore.validateProfile(bad));
        }

        @Test
        void optionalFieldsDoNotAffectRequiredFieldCheck() {
            Map<String, Object> doc = profile();
            doc.put("circuit_breaker", "x");
            doc.put("blocked_paths", 7);
            assertTrue(PolicyStore.validate(doc));
            assertEquals(Optional.of("blocked_paths"), PolicyStore.validateProfile(doc));

            Map<String, Object> mixedItems = profile();
            mixedItems.put("safe_commands", List.of("ls", 3));
            assertTrue(PolicyStore.validate(mixedItems));
            assertEquals(Optional.of("safe_commands"), PolicyStore.validateProfile(mixedItems));

            Map<String, Object> breakerOnly = profile();
            breakerOnly.put("circuit_breaker", "x");
            assertEquals(Optional.of("profiles.dev.circuit_breaker"),
                    PolicyStore.validateDocument(Map.of("profiles", Map.of("dev", breakerOnly))));
        }

        @Test
        void enforcerExposesValidation() {
            assertTrue(SandboxEnforcer.validatePolicy(profile()));
        }
    }
}
