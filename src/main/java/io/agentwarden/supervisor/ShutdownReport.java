package io.agentwarden.supervisor;

import java.util.List;

public record ShutdownReport(
        ShutdownMode mode,
        boolean clean,
        List<String> stoppedRoles,
        List<String> forcedRoles,
        List<String> terminalRoles,
        int exitCode
) {
    public ShutdownReport {
        stoppedRoles = List.copyOf(stoppedRoles);
        forcedRoles = List.copyOf(forcedRoles);
        terminalRoles = List.copyOf(terminalRoles);
    }

    /**
     * Terminal workers take precedence over forced terminations.
     */
    public static int exitCodeFor(List<String> forcedRoles, List<String> terminalRoles) {
        if (!terminalRoles.isEmpty()) {
            return SupervisorExitCodes.TERMINAL_WORKERS;
        }
        if (!forcedRoles.isEmpty()) {
            return SupervisorExitCodes.FORCED_TERMINATION;
        }
        return SupervisorExitCodes.CLEAN;
    }
}
