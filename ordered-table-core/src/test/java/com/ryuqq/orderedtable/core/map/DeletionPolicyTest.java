package com.ryuqq.orderedtable.core.map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeletionPolicy 테스트.
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
class DeletionPolicyTest {

    @Test
    void nullDeletes_OnlyNullIsDeletionSignal() {
        assertTrue(DeletionPolicy.NULL_DELETES.isDeletionSignal(null));
        assertFalse(DeletionPolicy.NULL_DELETES.isDeletionSignal(Boolean.FALSE));
        assertFalse(DeletionPolicy.NULL_DELETES.isDeletionSignal(0));
        assertFalse(DeletionPolicy.NULL_DELETES.isDeletionSignal(""));
    }

    @Test
    void falsyDeletes_NullAndFalseAreDeletionSignals() {
        assertTrue(DeletionPolicy.FALSY_DELETES.isDeletionSignal(null));
        assertTrue(DeletionPolicy.FALSY_DELETES.isDeletionSignal(Boolean.FALSE));
        assertFalse(DeletionPolicy.FALSY_DELETES.isDeletionSignal(Boolean.TRUE));
        assertFalse(DeletionPolicy.FALSY_DELETES.isDeletionSignal(0));
        assertFalse(DeletionPolicy.FALSY_DELETES.isDeletionSignal(""));
    }
}
