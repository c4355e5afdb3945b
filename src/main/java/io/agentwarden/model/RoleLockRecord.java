package io.agentwarden.model;

public record RoleLockRecord(String role, long holderPid, long acquiredAtMs) {
}
