package com.gdin.inspection.riskgraph.index.embedding;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RandomWalkGeneratorTest {

    private final RandomWalkGenerator generator = new RandomWalkGenerator();

    // 0-1-2-3 链 + 孤立点 4
    private final int[][] adjacency = {{1}, {0, 2}, {1, 3}, {2}, {}};

    @Test
    void walksFollowEdgesAndSkipIsolatedNodes() {
        EmbeddingOptions options = EmbeddingOptions.builder().numWalks(3).walkLength(6).build();
        List<int[]> walks = generator.generate(adjacency, options, 2);

        assertEquals(3 * 4, walks.size());
        for (int[] walk : walks) {
            assertEquals(6, walk.length);
            for (int i = 1; i < walk.length; i++) {
                int prev = walk[i - 1];
                int cur = walk[i];
                assertTrue(Arrays.stream(adjacency[prev]).anyMatch(x -> x == cur));
            }
            assertTrue(walk[0] != 4);
        }
    }

    @Test
    void walksDoNotDependOnWorkerCount() {
        EmbeddingOptions options = EmbeddingOptions.builder().numWalks(10).walkLength(5).returnParam(0.5).inOutParam(2.0).build();
        List<int[]> one = generator.generate(adjacency, options, 1);
        List<int[]> many = generator.generate(adjacency, options, 8);

        assertEquals(one.size(), many.size());
        for (int i = 0; i < one.size(); i++) assertArrayEquals(one.get(i), many.get(i));
    }

    @Test
    void highReturnPenaltyAvoidsBacktracking() {
        // 1/p 极小：在有其他选择时几乎不回头
        EmbeddingOptions options = EmbeddingOptions.builder().walkLength(3).returnParam(1e9).inOutParam(1.0).build();
        int[][] star = {{1}, {0, 2}, {1}};
        SplittableRandom rnd = new SplittableRandom(3);
        for (int i = 0; i < 200; i++) {
            int[] walk = generator.walk(star, 0, options, rnd);
            assertEquals(2, walk[2]);
        }
    }
}
