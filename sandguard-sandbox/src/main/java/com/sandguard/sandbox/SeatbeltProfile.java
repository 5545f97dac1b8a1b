package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.Boundaries;
import com.sandguard.common.infra.Hashing;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates macOS Seatbelt ({@code sandbox-exec -f}) profiles from
 * {@link Boundaries}. Everything is denied by default; reads and writes are
 * granted per subpath and network only when the boundaries allow it.
 */
@Slf4j
public class SeatbeltProfile {

    private static final List<String> SYSTEM_READ_PATHS = List.of(
            "/usr/lib", "/usr/bin", "/bin", "/System", "/Library", "/private/etc", "/dev");

    private final Path directory;

    /**
     * @param directory where generated profile files are written
     */
    public SeatbeltProfile(Path directory) {
        this.directory = directory;
    }

    public String render(Boundaries boundaries) {
        List<String> profile = new ArrayList<>();
        profile.add("(version 1)");
        profile.add("(deny default)");
        profile.add("");
        profile.add("; process");
        profile.add("(allow process-exec)");
        profile.add("(allow process-fork)");
        profile.add("(allow signal (target same-sandbox))");
        profile.add("(allow sysctl-read)");
        profile.add("");
        profile.add("; system reads");
        for (String path : SYSTEM_READ_PATHS) {
            profile.add("(allow file-read* (subpath " + escapePath(path) + "))");
        }
        profile.add("(allow file-read* (literal \"/\"))");

        if (!boundaries.readOnly().isEmpty() || !boundaries.readWrite().isEmpty()) {
            profile.add("");
            profile.add("; reads");
            for (String path : boundaries.readOnly()) {
                profile.add("(allow file-read* (subpath " + escapePath(path) + "))");
            }
            for (String path : boundaries.readWrite()) {
                profile.add("(allow file-read* (subpath " + escapePath(path) + "))");
            }
        }

        profile.add("");
        profile.add("; writes");
        profile.add("(allow file-write* (literal \"/dev/null\"))");
        for (String path : boundaries.readWrite()) {
            profile.add("(allow file-write* (subpath " + escapePath(path) + "))");
        }

        if (boundaries.network()) {
            profile.add("");
            profile.add("; network");
            profile.add("(allow network*)");
        }
        return String.join("\n", profile) + "\n";
    }

    /**
     * Render the profile and return the {@code .sb} file holding it. Files are
     * named by a hash of their content, so equal boundaries share one file and
     * the directory holds at most one file per distinct profile. The files are
     * left in place for later calls.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(Boundaries boundaries) {
        String content = render(boundaries);
        Path file = directory.resolve("sandguard-" + Hashing.sha256Hex(content).substring(0, 16) + ".sb");
        try {
            if (Files.isRegularFile(file) && content.equals(Files.readString(file, StandardCharsets.UTF_8))) {
                return file;
            }
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "sandguard-", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote seatbelt profile {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write seatbelt profile in " + directory, e);
        }
    }

    static String escapePath(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2);
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (ch <= 0x1F) {
                        out.append(String.format("\\u%04x", (int) ch));
                    } else {
                        out.append(ch);
                    }
                }
            }
        }
        out.append('"');
        return out.toString();
    }
}
