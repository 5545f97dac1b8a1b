package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;
import com.sandguard.sandbox.SandboxTypes.SandboxBinary;

import java.util.Objects;

/**
 * Uses bubblewrap when {@code bwrap} is on the PATH.
 */
public class LinuxSandboxBinaryResolver implements SandboxBinaryResolver {

    private final ExecutableLookup lookup;

    public LinuxSandboxBinaryResolver(ExecutableLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    @Override
    public ResolvedSandboxBinary resolve() {
        return SandboxBinaryResolvers.lookupOrNone(lookup, SandboxBinary.BWRAP);
    }
}
