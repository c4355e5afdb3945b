package io.agentwarden.supervisor;

public final class ProcessSpawnException extends RuntimeException {
    private final String role;

    public ProcessSpawnException(String role, Throwable cause) {
        super("Failed to spawn worker for role " + role + ": " + cause.getMessage(), cause);
        this.role = role;
    }

    public String role() {
        return role;
    }
}
