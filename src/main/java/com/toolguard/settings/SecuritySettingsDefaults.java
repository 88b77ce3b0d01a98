package com.toolguard.settings;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in policy applied before initialization and after a reset.
 */
public final class SecuritySettingsDefaults {

    /** Common developer and read-only CLI tools, anchored at the start of the command. */
    public static final List<String> DEFAULT_ALLOWLIST = List.of(
            "^git\\b", "^npm\\b", "^npx\\b", "^node\\b", "^yarn\\b", "^pnpm\\b",
            "^bun\\b", "^deno\\b", "^tsc\\b", "^eslint\\b", "^prettier\\b", "^jest\\b",
            "^vitest\\b", "^python\\b", "^python3\\b", "^pip\\b", "^pip3\\b", "^pipx\\b",
            "^poetry\\b", "^uv\\b", "^pytest\\b", "^black\\b", "^ruff\\b", "^mypy\\b",
            "^cargo\\b", "^rustc\\b", "^rustup\\b", "^go\\b", "^gofmt\\b", "^java\\b",
            "^javac\\b", "^mvn\\b", "^gradle\\b", "^kotlin\\b", "^scala\\b", "^sbt\\b",
            "^dotnet\\b", "^ruby\\b", "^gem\\b", "^bundle\\b", "^rake\\b", "^php\\b",
            "^composer\\b", "^swift\\b", "^make\\b", "^cmake\\b", "^ninja\\b", "^gcc\\b",
            "^g\\+\\+(\\s|$)", "^clang\\b", "^ls\\b", "^cat\\b", "^echo\\b", "^pwd$",
            "^which\\b", "^whereis\\b", "^whoami$", "^id$", "^date$", "^cal$",
            "^uname\\b", "^hostname$", "^uptime$", "^printenv\\b", "^find\\b",
            "^head\\b", "^tail\\b", "^wc\\b", "^grep\\b", "^egrep\\b", "^fgrep\\b",
            "^rg\\b", "^ag\\b", "^fd\\b", "^tree\\b", "^less\\b", "^more\\b",
            "^file\\b", "^stat\\b", "^du\\b", "^df\\b", "^sort\\b", "^uniq\\b",
            "^cut\\b", "^tr\\b", "^awk\\b", "^jq\\b", "^yq\\b", "^diff\\b",
            "^cmp\\b", "^comm\\b", "^column\\b", "^nl\\b", "^fold\\b", "^fmt\\b",
            "^paste\\b", "^join\\b", "^split\\b", "^basename\\b", "^dirname\\b",
            "^realpath\\b", "^readlink\\b", "^md5sum\\b", "^sha1sum\\b", "^sha256sum\\b", "^base64\\b",
            "^hexdump\\b", "^xxd\\b", "^od\\b", "^strings\\b", "^ps\\b", "^top\\b",
            "^htop\\b", "^free\\b", "^lsof\\b", "^vmstat\\b", "^iostat\\b", "^pgrep\\b",
            "^tar\\b", "^zip\\b",
            "^unzip\\b", "^gzip\\b", "^gunzip\\b", "^man\\b", "^help\\b", "^type\\b",
            "^history\\b", "^alias\\b", "^test\\b", "^true$", "^false$", "^sleep\\b",
            "^seq\\b", "^bc\\b", "^expr\\b"
    );

    private SecuritySettingsDefaults() {}

    public static SecuritySettings create() {
        SecuritySettings settings = new SecuritySettings();
        settings.setAutoDenyPrivilegeEscalation(true);
        settings.setAutoDenyCritical(true);
        settings.setRequireTypeToCritical(true);
        settings.setCommandAllowlist(new ArrayList<>(DEFAULT_ALLOWLIST));
        settings.setCommandDenylist(new ArrayList<>());
        settings.setSessionOverrideUntil(null);
        settings.setTokenRotationIntervalDays(0);
        settings.setReadOnlyProjects(false);
        return settings;
    }
}
