package org.routecraft.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Reconstruction Tests")
class PathReconstructorTest {
    private static final int NONE = PathReconstructor.NO_PREDECESSOR;

    @Test
    @DisplayName("Walks predecessors back to start and reverses")
    void testChain() {
        int[] cameFrom = {NONE, 0, 1, 2};
        IntArrayList path = PathReconstructor.reconstruct(cameFrom, 0, 3, 4);
        assertNotNull(path);
        assertArrayEquals(new int[]{0, 1, 2, 3}, path.toIntArray());
    }

    @Test
    @DisplayName("Start equal to goal")
    void testSingleNode() {
        int[] cameFrom = {NONE, NONE};
        IntArrayList path = PathReconstructor.reconstruct(cameFrom, 1, 1, 2);
        assertNotNull(path);
        assertArrayEquals(new int[]{1}, path.toIntArray());
    }

    @Test
    @DisplayName("Broken chain yields null")
    void testBrokenChain() {
        int[] cameFrom = {NONE, NONE, 1, 2};
        assertNull(PathReconstructor.reconstruct(cameFrom, 0, 3, 4));
    }

    @Test
    @DisplayName("Cyclic chain terminates with null")
    void testCycle() {
        int[] cameFrom = {NONE, 3, 1, 2};
        assertNull(PathReconstructor.reconstruct(cameFrom, 0, 3, 4));
    }
}
