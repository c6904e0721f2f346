package com.ryuqq.orderedtable.testkit.contract;

import com.ryuqq.orderedtable.core.iteration.Pair;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Reverse Symmetry.
 *
 * <p>Backward traversal must yield the exact reverse of forward traversal,
 * for both the pair and the key-only variants, including after deletions.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
class ReverseSymmetryContractTest extends AbstractOrderedMapContractTest {

    @Test
    void testReverse_KeyOnly_IsExactReverse() {
        // Given
        insertAll("A", "B", "C", "D");

        // When
        List<String> forward = forwardKeys();
        List<String> backward = backwardKeys();

        // Then
        Collections.reverse(backward);
        assertEquals(forward, backward);
    }

    @Test
    void testReverse_Pairs_IsExactReverse() {
        // Given
        insertAll("A", "B", "C");
        map.set("B", true);

        // When
        List<Pair<String, Boolean>> forward = forwardPairs();
        List<Pair<String, Boolean>> backward = new ArrayList<>(backwardPairs());

        // Then
        Collections.reverse(backward);
        assertEquals(forward, backward);
    }

    @Test
    void testReverse_AfterInteriorAndEndDeletes_StillSymmetric() {
        // Given
        insertAll("A", "B", "C", "D", "E");
        map.delete("A");
        map.delete("C");
        map.set("E", null);

        // When
        List<String> backward = backwardKeys();

        // Then
        assertEquals(List.of("D", "B"), backward);
        assertKeyOrder("B", "D");
    }

    @Test
    void testReverse_SingleKey_SameBothWays() {
        // Given
        insertAll("only");

        // Then
        assertEquals(List.of("only"), forwardKeys());
        assertEquals(List.of("only"), backwardKeys());
    }
}
