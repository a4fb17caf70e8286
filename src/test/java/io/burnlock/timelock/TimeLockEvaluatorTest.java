package io.burnlock.timelock;

import io.burnlock.error.ErrorKind;
import io.burnlock.error.LifecycleException;
import io.burnlock.model.LockVerdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TimeLockEvaluatorTest {

    @Test
    void unlocksExactlyAtTheConditionHeight() {
        Assertions.assertEquals(LockVerdict.LOCKED, TimeLockEvaluator.evaluate(150L, 149L));
        Assertions.assertEquals(LockVerdict.UNLOCKED, TimeLockEvaluator.evaluate(150L, 150L));
        Assertions.assertEquals(LockVerdict.UNLOCKED, TimeLockEvaluator.evaluate(150L, 151L));
    }

    @Test
    void absentConditionIsAlwaysUnlocked() {
        Assertions.assertEquals(LockVerdict.UNLOCKED, TimeLockEvaluator.evaluate(null, 0L));
        Assertions.assertEquals(LockVerdict.UNLOCKED, TimeLockEvaluator.evaluate(null, Long.MAX_VALUE));
    }

    @Test
    void verdictMatchesHeightComparisonAcrossRange() {
        for (long condition = 0; condition < 40; condition += 7) {
            for (long height = 0; height < 40; height++) {
                LockVerdict expected = height >= condition ? LockVerdict.UNLOCKED : LockVerdict.LOCKED;
                Assertions.assertEquals(expected, TimeLockEvaluator.evaluate(condition, height),
                        "condition=" + condition + " height=" + height);
            }
        }
    }

    @Test
    void validateNewRejectsPastAndFarFutureConditions() {
        TimeLockEvaluator evaluator = new TimeLockEvaluator(1_000L);

        LifecycleException current = Assertions.assertThrows(LifecycleException.class,
                () -> evaluator.validateNew(100L, 100L));
        Assertions.assertEquals(ErrorKind.PRECONDITION, current.kind());

        LifecycleException past = Assertions.assertThrows(LifecycleException.class,
                () -> evaluator.validateNew(50L, 100L));
        Assertions.assertEquals(ErrorKind.PRECONDITION, past.kind());

        LifecycleException tooFar = Assertions.assertThrows(LifecycleException.class,
                () -> evaluator.validateNew(1_101L, 100L));
        Assertions.assertEquals(ErrorKind.PRECONDITION, tooFar.kind());

        Assertions.assertDoesNotThrow(() -> evaluator.validateNew(101L, 100L));
        Assertions.assertDoesNotThrow(() -> evaluator.validateNew(1_100L, 100L));
        Assertions.assertDoesNotThrow(() -> evaluator.validateNew(null, 100L));
    }

    @Test
    void horizonMustBePositive() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TimeLockEvaluator(0L));
    }
}
