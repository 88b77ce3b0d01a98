package com.toolguard.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operator security policy. Instances handed out by {@link SecuritySettingsStore}
 * are private copies; mutating one has no effect until it is saved.
 * <p>
 * {@code sessionOverrideUntil} is only expired lazily. Read the override through
 * {@link SessionOverride#remaining()}, never through the raw field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SecuritySettings {

    private boolean autoDenyPrivilegeEscalation;
    private boolean autoDenyCritical;
    private boolean requireTypeToCritical;
    private List<String> commandAllowlist = new ArrayList<>();
    private List<String> commandDenylist = new ArrayList<>();
    private Long sessionOverrideUntil;
    private int tokenRotationIntervalDays;
    private boolean readOnlyProjects;

    public SecuritySettings() {}

    public SecuritySettings copy() {
        SecuritySettings copy = new SecuritySettings();
        copy.autoDenyPrivilegeEscalation = autoDenyPrivilegeEscalation;
        copy.autoDenyCritical = autoDenyCritical;
        copy.requireTypeToCritical = requireTypeToCritical;
        copy.commandAllowlist = new ArrayList<>(commandAllowlist);
        copy.commandDenylist = new ArrayList<>(commandDenylist);
        copy.sessionOverrideUntil = sessionOverrideUntil;
        copy.tokenRotationIntervalDays = tokenRotationIntervalDays;
        copy.readOnlyProjects = readOnlyProjects;
        return copy;
    }

    public boolean isAutoDenyPrivilegeEscalation() { return autoDenyPrivilegeEscalation; }
    public void setAutoDenyPrivilegeEscalation(boolean v) { this.autoDenyPrivilegeEscalation = v; }

    public boolean isAutoDenyCritical() { return autoDenyCritical; }
    public void setAutoDenyCritical(boolean autoDenyCritical) { this.autoDenyCritical = autoDenyCritical; }

    public boolean isRequireTypeToCritical() { return requireTypeToCritical; }
    public void setRequireTypeToCritical(boolean v) { this.requireTypeToCritical = v; }

    public List<String> getCommandAllowlist() { return commandAllowlist; }
    public void setCommandAllowlist(List<String> commandAllowlist) {
        this.commandAllowlist = commandAllowlist != null ? new ArrayList<>(commandAllowlist) : new ArrayList<>();
    }

    public List<String> getCommandDenylist() { return commandDenylist; }
    public void setCommandDenylist(List<String> commandDenylist) {
        this.commandDenylist = commandDenylist != null ? new ArrayList<>(commandDenylist) : new ArrayList<>();
    }

    public Long getSessionOverrideUntil() { return sessionOverrideUntil; }
    public void setSessionOverrideUntil(Long sessionOverrideUntil) { this.sessionOverrideUntil = sessionOverrideUntil; }

    public int getTokenRotationIntervalDays() { return tokenRotationIntervalDays; }
    public void setTokenRotationIntervalDays(int days) { this.tokenRotationIntervalDays = days; }

    public boolean isReadOnlyProjects() { return readOnlyProjects; }
    public void setReadOnlyProjects(boolean readOnlyProjects) { this.readOnlyProjects = readOnlyProjects; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecuritySettings that)) return false;
        return autoDenyPrivilegeEscalation == that.autoDenyPrivilegeEscalation
                && autoDenyCritical == that.autoDenyCritical
                && requireTypeToCritical == that.requireTypeToCritical
                && tokenRotationIntervalDays == that.tokenRotationIntervalDays
                && readOnlyProjects == that.readOnlyProjects
                && commandAllowlist.equals(that.commandAllowlist)
                && commandDenylist.equals(that.commandDenylist)
                && Objects.equals(sessionOverrideUntil, that.sessionOverrideUntil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(autoDenyPrivilegeEscalation, autoDenyCritical, requireTypeToCritical,
                commandAllowlist, commandDenylist, sessionOverrideUntil,
                tokenRotationIntervalDays, readOnlyProjects);
    }

    @Override
    public String toString() {
        return "SecuritySettings{" +
                "autoDenyPrivilegeEscalation=" + autoDenyPrivilegeEscalation +
                ", autoDenyCritical=" + autoDenyCritical +
                ", requireTypeToCritical=" + requireTypeToCritical +
                ", allowlist=" + commandAllowlist.size() +
                ", denylist=" + commandDenylist.size() +
                ", sessionOverrideUntil=" + sessionOverrideUntil +
                ", tokenRotationIntervalDays=" + tokenRotationIntervalDays +
                ", readOnlyProjects=" + readOnlyProjects +
                '}';
    }
}
