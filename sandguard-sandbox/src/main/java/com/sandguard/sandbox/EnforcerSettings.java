package com.sandguard.sandbox;

import com.sandguard.common.infra.EnvUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Construction-time settings for a {@link SandboxEnforcer}, resolved once from
 * explicit arguments and the environment.
 *
 * @param profile        requested profile name (may still fall back to the
 *                       policy's default profile)
 * @param sandboxEnabled {@code SANDBOX_ENABLED}, default true
 * @param projectRoot    directory the policy cascade is resolved against
 */
public record EnforcerSettings(String profile, boolean sandboxEnabled, Path projectRoot) {

    private static final Logger log = LoggerFactory.getLogger(EnforcerSettings.class);

    public static final String ENV_SANDBOX_PROFILE = "SANDBOX_PROFILE";
    public static final String ENV_SANDBOX_ENABLED = "SANDBOX_ENABLED";
    public static final String DEFAULT_PROFILE = "development";

    /**
     * Resolve settings against the current process environment and working
     * directory.
     */
    public static EnforcerSettings fromEnvironment(String explicitProfile) {
        return resolve(explicitProfile, System.getenv(), Path.of("").toAbsolutePath());
    }

    /**
     * Resolve settings. An explicit profile wins over {@code SANDBOX_PROFILE};
     * when neither is given the profile is {@value #DEFAULT_PROFILE}.
     */
    public static EnforcerSettings resolve(String explicitProfile, Map<String, String> env, Path projectRoot) {
        String profile;
        if (explicitProfile != null) {
            profile = explicitProfile;
        } else {
            profile = EnvUtils.getEnv(env, ENV_SANDBOX_PROFILE, DEFAULT_PROFILE);
        }
        boolean enabled = EnvUtils.getEnvBoolean(env, ENV_SANDBOX_ENABLED, true);
        if (!enabled) {
            log.info("env: {} disables sandbox wrapping", ENV_SANDBOX_ENABLED);
        }
        Path root = projectRoot != null ? projectRoot : Path.of("").toAbsolutePath();
        return new EnforcerSettings(profile, enabled, root);
    }
}
