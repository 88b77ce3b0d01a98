package com.toolguard.risk;

import java.util.List;

import static com.toolguard.risk.RiskLevel.CRITICAL;
import static com.toolguard.risk.RiskLevel.HIGH;
import static com.toolguard.risk.RiskLevel.MEDIUM;

/**
 * Ordered danger pattern table. Position is precedence: the classifier returns
 * the first entry that matches, regardless of how severe later entries are.
 * Do not reorder entries to "fix" severity; existing approval flows rely on
 * which label fires for a given command.
 */
public final class DangerPatternTable {

    private static final List<DangerPattern> PATTERNS = List.of(
            // --- CRITICAL: privilege escalation ---
            DangerPattern.of("\\bsudo\\b", CRITICAL,
                    "Privilege Escalation", "Uses sudo to run commands as root"),
            DangerPattern.of("\\bsu\\s+(-|root|\\w)", CRITICAL,
                    "Privilege Escalation", "Switches to another user (su)"),
            DangerPattern.of("\\bdoas\\b", CRITICAL,
                    "Privilege Escalation", "Uses doas to run commands as root"),
            DangerPattern.of("\\bpkexec\\b", CRITICAL,
                    "Privilege Escalation", "Uses pkexec for privilege escalation"),
            DangerPattern.of("\\brunas\\b", CRITICAL,
                    "Privilege Escalation", "Uses runas to run as another user"),

            // --- CRITICAL: destructive deletion ---
            // Also fires for forced deletes of ordinary absolute paths (rm -f /tmp/x).
            DangerPattern.of("\\brm\\s+(-[a-z]*f[a-z]*\\s+(-[a-z]*r[a-z]*\\s+)?|-[a-z]*r[a-z]*\\s+(-[a-z]*f[a-z]*\\s+)?)[/\"'~*]",
                    CRITICAL, "Destructive Deletion",
                    "Recursive forced deletion targeting root, home, or wildcard paths"),
            DangerPattern.of("\\brm\\s+-rf\\s*/", CRITICAL,
                    "Destructive Deletion", "rm -rf / destroys the entire filesystem"),
            DangerPattern.of("\\brm\\s+-rf\\s+~", CRITICAL,
                    "Destructive Deletion", "rm -rf ~ destroys the home directory"),
            DangerPattern.of("\\bfind\\s+/\\S*\\s.*-delete\\b", CRITICAL,
                    "Destructive Deletion", "find ... -delete sweeps files from an absolute path"),

            // --- CRITICAL: disk destruction ---
            DangerPattern.of("\\bdd\\s+if=", CRITICAL,
                    "Disk Write", "dd can overwrite disk partitions or devices"),
            DangerPattern.of("\\bmkfs\\b", CRITICAL,
                    "Disk Format", "mkfs formats a disk partition"),
            DangerPattern.of("\\bfdisk\\b", CRITICAL,
                    "Disk Partition", "fdisk modifies disk partitions"),
            DangerPattern.of("\\bwipefs\\b", CRITICAL,
                    "Disk Wipe", "wipefs erases filesystem signatures"),
            DangerPattern.of(">\\s*/dev/(sd|hd|nvme|disk)", CRITICAL,
                    "Device Write", "Writing directly to a block device"),

            // --- CRITICAL: fork bomb ---
            DangerPattern.of(":\\(\\)\\s*\\{.*\\|.*&\\s*\\}\\s*;?\\s*:", CRITICAL,
                    "Fork Bomb", "Shell fork bomb that exhausts process slots"),

            // --- CRITICAL: remote code execution ---
            DangerPattern.of("\\bcurl\\b.*\\|\\s*(ba|z)?sh\\b", CRITICAL,
                    "Remote Code Exec", "Downloads and executes remote script (curl | sh)"),
            DangerPattern.of("\\bwget\\b.*\\|\\s*(ba|z)?sh\\b", CRITICAL,
                    "Remote Code Exec", "Downloads and executes remote script (wget | sh)"),
            DangerPattern.of("\\bcurl\\b.*\\|\\s*(python[0-9.]*|perl|ruby|node)\\b", CRITICAL,
                    "Remote Code Exec", "Downloads and pipes to an interpreter"),
            DangerPattern.of("\\bwget\\b.*\\|\\s*(python[0-9.]*|perl|ruby|node)\\b", CRITICAL,
                    "Remote Code Exec", "Downloads and pipes to an interpreter"),
            DangerPattern.of("\\b(ba|z)?sh\\s+<\\(\\s*(curl|wget)\\b", CRITICAL,
                    "Remote Code Exec", "Executes a downloaded script via process substitution"),

            // --- HIGH: firewall / network security ---
            DangerPattern.of("\\biptables\\s+-F", HIGH,
                    "Firewall Flush", "Flushes all iptables firewall rules"),
            DangerPattern.of("\\bufw\\s+disable", HIGH,
                    "Firewall Disable", "Disables the UFW firewall"),
            DangerPattern.of("\\bfirewalld?\\b.*stop", HIGH,
                    "Firewall Stop", "Stops the firewall daemon"),
            DangerPattern.of("\\bsetenforce\\s+0\\b", HIGH,
                    "SELinux Disable", "Switches SELinux to permissive mode"),

            // --- HIGH: user / account modification ---
            // Also fires on reads of /etc/passwd.
            DangerPattern.of("\\bpasswd\\b", HIGH,
                    "Password Change", "Modifies user passwords"),
            DangerPattern.of("\\bchpasswd\\b", HIGH,
                    "Password Change", "Batch modifies user passwords"),
            DangerPattern.of("\\busermod\\b", HIGH,
                    "User Modification", "Modifies user account properties"),
            DangerPattern.of("\\buseradd\\b", HIGH,
                    "User Creation", "Creates a new user account"),
            DangerPattern.of("\\buserdel\\b", HIGH,
                    "User Deletion", "Deletes a user account"),
            DangerPattern.of("\\bvisudo\\b|/etc/sudoers", HIGH,
                    "Sudoers Modification", "Edits sudo privileges"),
            DangerPattern.of("\\bchmod\\s+([ugoa]*\\+s|[0-7]?[4-7][0-7]{3})\\b", HIGH,
                    "Setuid Bit", "Sets the setuid/setgid bit on a file"),

            // --- HIGH: process killing ---
            DangerPattern.of("\\bkill\\s+-9\\s+1\\b", HIGH,
                    "Kill Init", "Sends SIGKILL to PID 1 (init)"),
            DangerPattern.of("\\bkillall\\b", HIGH,
                    "Kill All Processes", "Kills all processes matching a name"),

            // --- HIGH: scheduled tasks, keys, history ---
            DangerPattern.of("\\bcrontab\\s+-r\\b", HIGH,
                    "Cron Wipe", "Removes all crontab entries"),
            DangerPattern.of("\\bssh-keygen\\b.*-f", HIGH,
                    "SSH Key Overwrite", "May overwrite existing SSH keys"),
            DangerPattern.of("\\bhistory\\s+-c\\b", HIGH,
                    "History Wipe", "Clears shell history"),

            // --- MEDIUM: permission changes ---
            DangerPattern.of("\\bchmod\\s+(777|a\\+rwx)", MEDIUM,
                    "Permission Exposure", "Sets world-readable/writable permissions (777)"),
            DangerPattern.of("\\bchmod\\s+-R\\s+777", MEDIUM,
                    "Recursive Perm Exposure", "Recursively sets 777 permissions"),
            DangerPattern.of("\\bchown\\b", MEDIUM,
                    "Ownership Change", "Changes file ownership"),

            // --- MEDIUM: eval ---
            DangerPattern.of("\\beval\\s", MEDIUM,
                    "Eval Execution", "Evaluates a string as shell code"),

            // --- MEDIUM: service modification ---
            DangerPattern.of("\\bsystemctl\\s+(stop|disable|mask)", MEDIUM,
                    "Service Modification", "Stops or disables a system service"),
            DangerPattern.of("\\bservice\\s+\\S+\\s+stop", MEDIUM,
                    "Service Stop", "Stops a system service"),

            // --- HIGH: destructive SQL ---
            // Listed after the MEDIUM rules: "chown ...; DROP TABLE ..." classifies as
            // Ownership Change (MEDIUM), not as the HIGH rule below.
            DangerPattern.of("\\bdrop\\s+(table|database|schema)\\b", HIGH,
                    "Destructive SQL", "Drops a table, schema or database"),
            DangerPattern.of("\\btruncate\\s+table\\b", HIGH,
                    "Destructive SQL", "Truncates a table"),
            DangerPattern.of("\\bdelete\\s+from\\s+[\\w.\"`]+\\s*(;|'|\"|$)", HIGH,
                    "Destructive SQL", "DELETE without a WHERE clause")
    );

    private DangerPatternTable() {}

    public static List<DangerPattern> entries() {
        return PATTERNS;
    }
}
