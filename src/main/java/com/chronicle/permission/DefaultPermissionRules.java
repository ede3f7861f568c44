package com.chronicle.permission;

import java.util.List;

/**
 * Built-in rule chain, split into the three tiers the engine evaluates in order:
 * deny, then ask, then the defaults that always produce a verdict.
 */
public final class DefaultPermissionRules {

    static final String[] EDIT_TOOLS = {"Write", "Edit", "MultiEdit", "NotebookEdit"};

    private DefaultPermissionRules() {
    }

    public static List<PermissionRule> deny() {
        return List.of(
                path("env-file", "(^|/)\\.env(\\.(?!example$|sample$|template$)[^/]+)?$",
                        "Access to environment file containing secrets is blocked"),
                path("ssh-private-key", "(^|/)id_(rsa|dsa|ecdsa|ed25519)$",
                        "Access to SSH private key is blocked"),
                path("key-material", "\\.(pem|key|p12|pfx|jks|keystore)$",
                        "Access to key or certificate store is blocked"),
                path("ssh-directory", "(^|/)\\.ssh/",
                        "Access to SSH configuration directory is blocked"),
                path("cloud-credentials", "(^|/)(\\.aws/credentials|\\.netrc|\\.pgpass|\\.docker/config\\.json)$",
                        "Access to stored credentials is blocked"),
                path("secrets-file", "(^|/)(secrets?|credentials)\\.(json|ya?ml|toml|txt|env)$",
                        "Access to secrets file is blocked"),
                path("system-auth-file", "^/etc/(shadow|gshadow|passwd|sudoers)",
                        "Access to system authentication file is blocked"),
                command("env-file-command",
                        "(^|[\\s;&|'\"<>=/])\\.env(?!\\.(example|sample|template)\\b)(\\.[\\w.-]+)?(?=$|[\\s;&|'\"<>)])",
                        "Command touches an environment file containing secrets"),
                command("recursive-delete-root",
                        "\\brm(?=[^;&|]*\\s-(?:[a-z]*r[a-z]*|-recursive)\\b)\\s+(?:-\\S+\\s+)*"
                                + "(?:/|~/?|\\$HOME/?|\\*|/(?:bin|boot|dev|etc|home|lib|lib64|opt|root|sbin|srv|sys|usr|var)/?)\\*?"
                                + "(?=\\s|$|[;&|`)])",
                        "Recursive deletion of root, home or system directory is blocked"),
                command("make-filesystem", "\\bmkfs(\\.\\w+)?\\b",
                        "Formatting a filesystem is blocked"),
                command("disk-overwrite",
                        "(\\bdd\\b[^;&|]*\\bof=/dev/|>\\s*/dev/)(sd|hd|nvme|disk|xvd|vd|mmcblk)",
                        "Writing directly to a block device is blocked"),
                command("fork-bomb", ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:",
                        "Fork bomb is blocked"),
                command("world-writable-root", "\\bchmod(?=[^;&|]*\\s-[a-z]*r)[^;&|]*\\s0?777\\s+/(?=\\s|$|[;&|])",
                        "Recursive chmod 777 on root is blocked"));
    }

    public static List<PermissionRule> ask() {
        return List.of(
                askCommand("privilege-escalation", "(^|[;&|(`\\n\\r])\\s*(sudo|su|doas|pkexec)(\\s|$)",
                        "Command requests elevated privileges"),
                askCommand("pipe-to-shell", "\\b(curl|wget)\\b[^;&|]*\\|\\s*(sudo\\s+)?(ba|z|da|k)?sh\\b",
                        "Downloaded script is piped into a shell"),
                askCommand("force-push", "\\bgit\\s+push\\b[^;&|]*\\s(--force(-with-lease)?|-f)(?=\\s|$)",
                        "Force push rewrites remote history"),
                PermissionRule.builder("dependency-manifest")
                        .target(RuleTarget.PATH)
                        .caseSensitivePattern("(^|/)(package\\.json|package-lock\\.json|yarn\\.lock|pnpm-lock\\.yaml"
                                + "|bun\\.lockb|requirements(-[\\w]+)?\\.txt|Pipfile(\\.lock)?|pyproject\\.toml|poetry\\.lock"
                                + "|uv\\.lock|Cargo\\.(toml|lock)|go\\.(mod|sum)|Gemfile(\\.lock)?|composer\\.(json|lock)"
                                + "|pom\\.xml|build\\.gradle(\\.kts)?|settings\\.gradle(\\.kts)?|gradle\\.lockfile)$")
                        .verdict(PermissionVerdict.ASK)
                        .reason("Editing dependency manifest or lock file requires confirmation")
                        .tools(EDIT_TOOLS)
                        .build());
    }

    public static List<PermissionRule> defaults() {
        return List.of(
                PermissionRule.builder("read-only-tool")
                        .target(RuleTarget.TOOL_NAME)
                        .caseSensitivePattern("^(Read|Glob|Grep|LS|NotebookRead|WebFetch|WebSearch|TodoRead)$")
                        .verdict(PermissionVerdict.ALLOW)
                        .reason("Read-only tool")
                        .build(),
                PermissionRule.builder("read-only-command")
                        .target(RuleTarget.COMMAND)
                        .pattern("^\\s*(?!.*\\s-(?:delete|exec|execdir|ok|okdir|fprint\\w*|fls)\\b)"
                                + "(?:(?:ls|pwd|cat|head|tail|wc|echo|grep|rg|find|which|whoami|date|tree|file|stat|du|df|uname"
                                + "|git[ \\t]+(?:status|log|diff|show))(?:[ \\t][^;&|`$<>\\n\\r]*)?"
                                + "|git[ \\t]+branch(?:[ \\t]+(?:-[arv]+|--list|--all|--remotes|--verbose|--show-current))*"
                                + "|git[ \\t]+remote(?:[ \\t]+(?:-v|--verbose|show(?:[ \\t]+[\\w.-]+)?|get-url[ \\t]+[\\w.-]+))?)"
                                + "\\s*$")
                        .verdict(PermissionVerdict.ALLOW)
                        .reason("Read-only shell command")
                        .tools("Bash")
                        .build(),
                PermissionRule.builder("executing-tool")
                        .target(RuleTarget.TOOL_NAME)
                        .pattern("^Bash$|shell|exec|run|command|terminal")
                        .verdict(PermissionVerdict.ASK)
                        .reason("Command execution requires confirmation")
                        .build(),
                PermissionRule.builder("command-input")
                        .target(RuleTarget.COMMAND)
                        .pattern("\\S")
                        .verdict(PermissionVerdict.ASK)
                        .reason("Tool runs a command that requires confirmation")
                        .build(),
                PermissionRule.builder("default-allow")
                        .target(RuleTarget.TOOL_NAME)
                        .pattern("^")
                        .verdict(PermissionVerdict.ALLOW)
                        .reason("No restriction applies")
                        .build());
    }

    private static PermissionRule path(String name, String regex, String reason) {
        return PermissionRule.builder(name)
                .target(RuleTarget.PATH)
                .pattern(regex)
                .verdict(PermissionVerdict.DENY)
                .reason(reason)
                .build();
    }

    private static PermissionRule command(String name, String regex, String reason) {
        return command(name, regex, reason, PermissionVerdict.DENY);
    }

    private static PermissionRule askCommand(String name, String regex, String reason) {
        return command(name, regex, reason, PermissionVerdict.ASK);
    }

    private static PermissionRule command(String name, String regex, String reason, PermissionVerdict verdict) {
        return PermissionRule.builder(name)
                .target(RuleTarget.COMMAND)
                .pattern(regex)
                .verdict(verdict)
                .reason(reason)
                .build();
    }
}
