package io.agentwarden.supervisor;

public final class SupervisorExitCodes {
    public static final int CLEAN = 0;
    public static final int TERMINAL_WORKERS = 1;
    public static final int LOCK_HELD = 2;
    public static final int FORCED_TERMINATION = 3;

    private SupervisorExitCodes() {
    }
}
