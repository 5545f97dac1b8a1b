package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;

/**
 * Decides which sandbox wrapper, if any, this host can use.
 */
public interface SandboxBinaryResolver {

    ResolvedSandboxBinary resolve();
}
