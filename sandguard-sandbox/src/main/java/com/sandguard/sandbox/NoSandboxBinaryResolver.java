package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;

/**
 * Windows and unknown platforms: no wrapper exists, so nothing is looked up.
 */
public class NoSandboxBinaryResolver implements SandboxBinaryResolver {

    @Override
    public ResolvedSandboxBinary resolve() {
        return ResolvedSandboxBinary.NONE;
    }
}
