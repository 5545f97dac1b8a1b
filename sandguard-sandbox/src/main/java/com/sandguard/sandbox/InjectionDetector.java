package com.sandguard.sandbox;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in detection of shell-injection and destructive-command techniques.
 * Rules run in a fixed order and the first hit wins, so the reported category
 * is the most specific one that applies.
 */
public final class InjectionDetector {

    private InjectionDetector() {
    }

    // -----------------------------------------------------------------------
    // Types
    // -----------------------------------------------------------------------

    public static final String FORK_BOMB = "fork-bomb";
    public static final String NULL_BYTE = "null-byte";
    public static final String UNICODE_LOOKALIKE = "unicode-lookalike";
    public static final String SYMLINK_CHAINING = "symlink-chaining";
    public static final String REMOTE_SCRIPT_PIPE = "remote-script-pipe";
    public static final String SHELL_METACHARACTER = "shell-metacharacter";
    public static final String PATH_TRAVERSAL = "path-traversal";
    public static final String DESTRUCTIVE_COMMAND = "destructive-command";
    public static final String PRIVILEGE_ESCALATION = "privilege-escalation";
    public static final String SENSITIVE_SYMLINK = "sensitive-symlink";

    /**
     * A rule hit.
     *
     * @param category rule category id
     * @param token    the literal token or signature that fired
     * @param reason   human-readable reason for the BLOCKED result
     */
    public record Detection(String category, String token, String reason) {
    }

    private record PatternRule(String category, String label, Pattern pattern, String fixedToken) {

        Optional<Detection> apply(String command) {
            Matcher m = pattern.matcher(command);
            if (!m.find()) {
                return Optional.empty();
            }
            String token = fixedToken;
            if (token == null) {
                token = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group();
            }
            return Optional.of(new Detection(category, token, label + ": '" + token + "'"));
        }
    }

    private record MetaRule(String token, String kind) {
    }

    // -----------------------------------------------------------------------
    // Fork bombs
    // -----------------------------------------------------------------------

    private static final List<PatternRule> FORK_BOMB_RULES = List.of(
            new PatternRule(FORK_BOMB, "Fork bomb detected",
                    Pattern.compile(":\\s*\\(\\s*\\)\\s*\\{.*}\\s*;"), null),
            // any function that pipes itself into itself
            new PatternRule(FORK_BOMB, "Fork bomb detected",
                    Pattern.compile("([A-Za-z_]\\w*|:)\\s*\\(\\s*\\)\\s*\\{[^}]*?\\1\\s*\\|\\s*\\1"), null));

    // -----------------------------------------------------------------------
    // Null bytes and look-alikes
    // -----------------------------------------------------------------------

    private static final List<String> NULL_BYTE_ENCODINGS = List.of("\\x00", "\\u0000", "%00");

    /** Fullwidth and small-form variants of shell metacharacters, plus other confusables. */
    private static final Set<Integer> LOOKALIKE_CODE_POINTS = Set.of(
            0xFF1B, 0xFF06, 0xFF5C, 0xFF04, 0xFF08, 0xFF09, 0xFF1E, 0xFF1C, 0xFF40,
            0xFE54, 0xFE60, 0xFE69, 0xFE59, 0xFE5A, 0xFE65, 0xFE64,
            0x037E, 0x2223, 0x01C0);

    private static boolean isHiddenSeparator(int cp) {
        return cp == 0x00A0 || cp == 0x1680
                || (cp >= 0x2000 && cp <= 0x200D)
                || cp == 0x2028 || cp == 0x2029 || cp == 0x202F
                || cp == 0x205F || cp == 0x2060 || cp == 0x3000 || cp == 0xFEFF;
    }

    // -----------------------------------------------------------------------
    // Chaining
    // -----------------------------------------------------------------------

    private static final PatternRule SYMLINK_CHAIN_RULE = new PatternRule(SYMLINK_CHAINING,
            "Symlink chaining detected",
            Pattern.compile("\\bln\\s+-[a-zA-Z]*s[a-zA-Z]*\\b.*(?:&&|\\|\\||;|\\|)"), "ln -s");

    private static final PatternRule REMOTE_PIPE_RULE = new PatternRule(REMOTE_SCRIPT_PIPE,
            "Remote script piped to shell (pipe)",
            Pattern.compile("\\b(?:curl|wget)\\b.*\\|\\s*(?:sudo\\s+)?(?:ba|z|da|k)?sh\\b"), null);

    /** Longer tokens first so {@code &&} is reported before {@code &}. */
    private static final List<MetaRule> META_RULES = List.of(
            new MetaRule("&&", "command chaining"),
            new MetaRule("||", "command chaining"),
            new MetaRule(";", "command separator"),
            new MetaRule("\n", "command separator"),
            new MetaRule("\r", "command separator"),
            new MetaRule("$(", "command substitution"),
            new MetaRule("`", "command substitution"),
            new MetaRule(">>", "output redirection"),
            new MetaRule(">", "output redirection"),
            new MetaRule("<", "input redirection"),
            new MetaRule("|", "pipe"),
            new MetaRule("&", "background execution"));

    // -----------------------------------------------------------------------
    // Destructive signatures
    // -----------------------------------------------------------------------

    private static final Pattern RM_FLAGS = Pattern.compile("(?:^|[\\s/])rm((?:\\s+-{1,2}[\\w-]+)+)");

    private static final List<PatternRule> DESTRUCTIVE_RULES = List.of(
            new PatternRule(DESTRUCTIVE_COMMAND, "Destructive command detected",
                    Pattern.compile("\\bchmod\\s+(?:-[a-zA-Z]+\\s+)*0?777\\b"), "chmod 777"),
            new PatternRule(DESTRUCTIVE_COMMAND, "Destructive command detected",
                    Pattern.compile("\\bdd\\b.*(?:\\bof=/dev/(?!null\\b|zero\\b)|\\bif=/dev/(?:sd|hd|nvme|disk|mmcblk))"),
                    "dd if="),
            new PatternRule(DESTRUCTIVE_COMMAND, "Destructive command detected",
                    Pattern.compile("(?:\\bof=|\\btee\\s+(?:-a\\s+)?)(/dev/(?:sd[a-z]|hd[a-z]|nvme\\d|disk\\d|mmcblk\\d)\\w*)"),
                    null),
            new PatternRule(DESTRUCTIVE_COMMAND, "Destructive command detected",
                    Pattern.compile("\\bgit\\s+push\\b.*\\s(?:--force(?:-with-lease)?|-f)\\b"), "git push --force"),
            new PatternRule(DESTRUCTIVE_COMMAND, "Destructive command detected",
                    Pattern.compile("\\bmkfs(?:\\.\\w+)?\\b"), "mkfs"));

    /**
     * Only the command word counts, optionally behind a path or launcher
     * wrappers such as {@code env FOO=1} or {@code nice -n 10}; {@code cat su}
     * reads a file named su.
     */
    private static final PatternRule PRIVILEGE_RULE = new PatternRule(PRIVILEGE_ESCALATION,
            "Privilege escalation detected",
            Pattern.compile("^\\s*(?:(?:env|exec|command|nohup|nice|time|timeout|stdbuf)"
                    + "(?:\\s+(?:-\\S+|\\w+=\\S*|\\d+))*\\s+)*"
                    + "(?:\\S*/)?(sudo|su|pkexec|doas)(?=\\s|$)"), null);

    private static final PatternRule SENSITIVE_SYMLINK_RULE = new PatternRule(SENSITIVE_SYMLINK,
            "Symlink to sensitive location detected",
            Pattern.compile("\\b(?:ln\\s+-[a-zA-Z]*s[a-zA-Z]*|symlink)\\s+.*?(/etc\\b|/root\\b|\\.ssh\\b|/var/root\\b)"),
            null);

    // -----------------------------------------------------------------------
    // Detection
    // -----------------------------------------------------------------------

    /**
     * Run every built-in rule against the command.
     *
     * @return the first rule hit, or empty if the command looks clean
     */
    public static Optional<Detection> detect(String command) {
        if (command == null || command.isEmpty()) {
            return Optional.empty();
        }

        for (PatternRule rule : FORK_BOMB_RULES) {
            Optional<Detection> hit = rule.apply(command);
            if (hit.isPresent()) {
                return hit;
            }
        }

        Optional<Detection> hit = detectNullByte(command)
                .or(() -> detectLookalike(command))
                .or(() -> SYMLINK_CHAIN_RULE.apply(command))
                .or(() -> REMOTE_PIPE_RULE.apply(command))
                .or(() -> detectMetacharacter(command))
                .or(() -> detectTraversal(command))
                .or(() -> detectRecursiveForceDelete(command));
        if (hit.isPresent()) {
            return hit;
        }

        for (PatternRule rule : DESTRUCTIVE_RULES) {
            hit = rule.apply(command);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return PRIVILEGE_RULE.apply(command).or(() -> SENSITIVE_SYMLINK_RULE.apply(command));
    }

    private static Optional<Detection> detectNullByte(String command) {
        if (command.indexOf('\0') >= 0) {
            return Optional.of(new Detection(NULL_BYTE, "\\0", "Null byte detected in command"));
        }
        for (String encoded : NULL_BYTE_ENCODINGS) {
            if (command.contains(encoded)) {
                return Optional.of(new Detection(NULL_BYTE, encoded,
                        "Null byte detected in command: '" + encoded + "'"));
            }
        }
        return Optional.empty();
    }

    private static Optional<Detection> detectLookalike(String command) {
        return command.codePoints()
                .filter(cp -> LOOKALIKE_CODE_POINTS.contains(cp) || isHiddenSeparator(cp))
                .boxed()
                .findFirst()
                .map(cp -> {
                    String token = String.format("U+%04X", cp);
                    return new Detection(UNICODE_LOOKALIKE, token,
                            "Unicode look-alike character detected: " + token);
                });
    }

    private static Optional<Detection> detectMetacharacter(String command) {
        for (MetaRule rule : META_RULES) {
            if (command.contains(rule.token())) {
                String shown = rule.token().replace("\n", "\\n").replace("\r", "\\r");
                return Optional.of(new Detection(SHELL_METACHARACTER, rule.token(),
                        "Shell injection pattern detected (" + rule.kind() + "): '" + shown + "'"));
            }
        }
        return Optional.empty();
    }

    private static Optional<Detection> detectTraversal(String command) {
        if (command.contains("..")) {
            return Optional.of(new Detection(PATH_TRAVERSAL, "..", "Path traversal pattern detected: '..'"));
        }
        return Optional.empty();
    }

    /**
     * {@code rm} with both a recursive and a force flag, in any spelling:
     * {@code -rf}, {@code -fr}, {@code -r -f}, {@code --recursive --force}.
     */
    private static Optional<Detection> detectRecursiveForceDelete(String command) {
        Matcher m = RM_FLAGS.matcher(command);
        while (m.find()) {
            boolean recursive = false;
            boolean force = false;
            for (String flag : m.group(1).trim().split("\\s+")) {
                if (flag.startsWith("--")) {
                    recursive |= flag.equals("--recursive");
                    force |= flag.equals("--force");
                } else {
                    recursive |= flag.indexOf('r') >= 0 || flag.indexOf('R') >= 0;
                    force |= flag.indexOf('f') >= 0;
                }
            }
            if (recursive && force) {
                return Optional.of(new Detection(DESTRUCTIVE_COMMAND, "rm -rf",
                        "Destructive command detected: 'rm -rf'"));
            }
        }
        return Optional.empty();
    }
}
