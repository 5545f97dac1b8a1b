package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.Boundaries;
import com.sandguard.sandbox.SandboxTypes.ResolvedSandboxBinary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the argument vector that runs a command inside the platform sandbox.
 * The result is ready for {@link ProcessBuilder}.
 */
public class SandboxArgsBuilder {

    private final ResolvedSandboxBinary binary;
    private final SeatbeltProfile seatbeltProfile;

    public SandboxArgsBuilder(ResolvedSandboxBinary binary, SeatbeltProfile seatbeltProfile) {
        this.binary = Objects.requireNonNull(binary, "binary");
        this.seatbeltProfile = seatbeltProfile;
    }

    /**
     * Wrap a command.
     * <ul>
     * <li>bwrap: {@code bwrap [--ro-bind p p]* [--bind p p]* [--unshare-net] words...}</li>
     * <li>sandbox-exec: {@code sandbox-exec -f <profile> words...}</li>
     * <li>none: the command words, unmodified</li>
     * </ul>
     */
    public List<String> build(String command, Boundaries boundaries) {
        Boundaries b = boundaries != null ? boundaries : Boundaries.none();
        List<String> words = ShellWords.split(command);

        List<String> args = new ArrayList<>();
        switch (binary.binary()) {
            case BWRAP -> {
                args.add(binary.path());
                b.readOnly().forEach(p -> args.addAll(List.of("--ro-bind", p, p)));
                b.readWrite().forEach(p -> args.addAll(List.of("--bind", p, p)));
                if (!b.network()) {
                    args.add("--unshare-net");
                }
            }
            case SANDBOX_EXEC -> {
                if (seatbeltProfile == null) {
                    throw new IllegalStateException("sandbox-exec requires a seatbelt profile directory");
                }
                Path profile = seatbeltProfile.write(b);
                args.addAll(List.of(binary.path(), "-f", profile.toString()));
            }
            case NONE -> {
                // passthrough
            }
        }
        args.addAll(words);
        return args;
    }
}
