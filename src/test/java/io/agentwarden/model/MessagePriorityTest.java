package io.agentwarden.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MessagePriorityTest {

    @Test
    void parsesNamesAndIntegers() {
        Assertions.assertEquals(1, MessagePriority.parse("urgent"));
        Assertions.assertEquals(5, MessagePriority.parse(" NORMAL "));
        Assertions.assertEquals(9, MessagePriority.parse("low"));
        Assertions.assertEquals(5, MessagePriority.parse(null));
        Assertions.assertEquals(3, MessagePriority.parse("3"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MessagePriority.parse("soon"));
    }

    @Test
    void messageStatusAcceptsCliSpellings() {
        Assertions.assertEquals(MessageStatus.IN_PROGRESS, MessageStatus.fromString("in-progress"));
        Assertions.assertEquals(MessageStatus.FAILED, MessageStatus.fromString("failed"));
        Assertions.assertTrue(MessageStatus.COMPLETED.isFinished());
        Assertions.assertFalse(MessageStatus.PENDING.isFinished());
        Assertions.assertThrows(IllegalArgumentException.class, () -> MessageStatus.fromString("done"));
    }
}
