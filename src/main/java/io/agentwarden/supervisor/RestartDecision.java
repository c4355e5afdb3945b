package io.agentwarden.supervisor;

public record RestartDecision(Action action, long waitMs) {
    public enum Action {
        RESTART_NOW,
        WAIT,
        GIVE_UP
    }

    public static RestartDecision restartNow() {
        return new RestartDecision(Action.RESTART_NOW, 0L);
    }

    public static RestartDecision waitFor(long waitMs) {
        return new RestartDecision(Action.WAIT, waitMs);
    }

    public static RestartDecision giveUp() {
        return new RestartDecision(Action.GIVE_UP, 0L);
    }
}
