package io.agentwarden.supervisor;

/**
 * A role lock is held by another live process.
 */
public final class RoleAlreadyRunningException extends RuntimeException {
    private final String role;
    private final Long holderPid;

    public RoleAlreadyRunningException(String role, Long holderPid) {
        super("Role " + role + " is already held" + (holderPid == null ? "" : " by pid " + holderPid));
        this.role = role;
        this.holderPid = holderPid;
    }

    public String role() {
        return role;
    }

    public Long holderPid() {
        return holderPid;
    }
}
