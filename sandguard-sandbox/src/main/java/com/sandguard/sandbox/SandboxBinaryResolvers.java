package com.sandguard.sandbox;

import com.sandguard.common.infra.Binaries;
import com.sandguard.common.infra.OsPlatform;
import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;
import com.sandguard.sandbox.SandboxTypes.SandboxBinary;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the {@link SandboxBinaryResolver} for a platform.
 */
@Slf4j
public final class SandboxBinaryResolvers {

    private SandboxBinaryResolvers() {
    }

    public static SandboxBinaryResolver forPlatform(OsPlatform platform, ExecutableLookup lookup) {
        return switch (platform) {
            case LINUX -> new LinuxSandboxBinaryResolver(lookup);
            case DARWIN -> new DarwinSandboxBinaryResolver(lookup);
            case WINDOWS, OTHER -> new NoSandboxBinaryResolver();
        };
    }

    /**
     * Resolver for the running OS, searching {@code PATH}.
     */
    public static SandboxBinaryResolver forCurrentPlatform() {
        return forPlatform(OsPlatform.current(), Binaries::resolveBinaryPath);
    }

    static ResolvedSandboxBinary lookupOrNone(ExecutableLookup lookup, SandboxBinary binary) {
        String path = lookup.find(binary.getExecutableName());
        if (path == null || path.isBlank()) {
            log.warn("{} not found on PATH, commands will run unwrapped", binary.getExecutableName());
            return ResolvedSandboxBinary.NONE;
        }
        log.debug("Using sandbox binary {}", path);
        return new ResolvedSandboxBinary(binary, path);
    }
}
