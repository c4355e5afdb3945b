package io.agentwarden.supervisor;

import io.agentwarden.config.WorkerRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class RestartPolicyTest {

    @Test
    void defaultRoleBacksOffExponentiallyThenGivesUp() {
        WorkerRole role = WorkerRole.withDefaults("architect", 1, List.of("true"));

        Assertions.assertEquals(RestartDecision.waitFor(60_000L), RestartPolicy.decide(0, role));
        Assertions.assertEquals(RestartDecision.waitFor(120_000L), RestartPolicy.decide(1, role));
        Assertions.assertEquals(RestartDecision.waitFor(240_000L), RestartPolicy.decide(2, role));
        Assertions.assertEquals(RestartDecision.Action.GIVE_UP, RestartPolicy.decide(3, role).action());
        Assertions.assertEquals(RestartDecision.Action.GIVE_UP, RestartPolicy.decide(7, role).action());
    }

    @Test
    void zeroBaseRestartsImmediately() {
        WorkerRole role = role(0L, 2);
        Assertions.assertEquals(RestartDecision.Action.RESTART_NOW, RestartPolicy.decide(0, role).action());
        Assertions.assertEquals(RestartDecision.Action.RESTART_NOW, RestartPolicy.decide(1, role).action());
        Assertions.assertEquals(RestartDecision.Action.GIVE_UP, RestartPolicy.decide(2, role).action());
    }

    @Test
    void zeroMaxRestartsGivesUpOnFirstCrash() {
        Assertions.assertEquals(RestartDecision.Action.GIVE_UP, RestartPolicy.decide(0, role(1_000L, 0)).action());
    }

    @Test
    void backoffSaturatesInsteadOfOverflowing() {
        Assertions.assertEquals(1_000L, RestartPolicy.backoffMs(1_000L, 0));
        Assertions.assertEquals(8_000L, RestartPolicy.backoffMs(1_000L, 3));
        Assertions.assertEquals(Long.MAX_VALUE, RestartPolicy.backoffMs(1_000L, 62));
        Assertions.assertEquals(Long.MAX_VALUE, RestartPolicy.backoffMs(Long.MAX_VALUE / 2, 2));
        Assertions.assertEquals(Long.MAX_VALUE, RestartPolicy.backoffMs(1L, 200));
    }

    @Test
    void remainingMsCountsDownToTheScheduledRestart() {
        WorkerProcess worker = new WorkerProcess(role(1_000L, 3));
        Assertions.assertEquals(0L, RestartPolicy.remainingMs(worker, 10L));
        worker.crashed(10L);
        worker.scheduleRestart(1_010L);
        Assertions.assertEquals(600L, RestartPolicy.remainingMs(worker, 410L));
        Assertions.assertEquals(0L, RestartPolicy.remainingMs(worker, 2_000L));
    }

    private static WorkerRole role(long backoffBaseMs, int maxRestarts) {
        return new WorkerRole("architect", 1, List.of("true"), null, null,
                1_000L, 5_000L, 10_000L, maxRestarts, backoffBaseMs, 90.0d, 1024L);
    }
}
