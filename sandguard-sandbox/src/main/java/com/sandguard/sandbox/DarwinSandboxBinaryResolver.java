package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;
import com.sandguard.sandbox.SandboxTypes.SandboxBinary;

import java.util.Objects;

/**
 * Uses the Seatbelt launcher {@code sandbox-exec} when it is on the PATH.
 */
public class DarwinSandboxBinaryResolver implements SandboxBinaryResolver {

    private final ExecutableLookup lookup;

    public DarwinSandboxBinaryResolver(ExecutableLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    @Override
    public ResolvedSandboxBinary resolve() {
        return SandboxBinaryResolvers.lookupOrNone(lookup, SandboxBinary.SANDBOX_EXEC);
    }
}
