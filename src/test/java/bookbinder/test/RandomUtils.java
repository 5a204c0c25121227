// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.LongStream;
import bookbinder.document.Section;
import bookbinder.util.annotation.Nullable;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static LongStream provideSeeds() {
        return LongStream.generate(SeedGenerator::generateSeed).limit(8);
    }

    /**
     * Generates a random forest of sections. Identifiers are unique; labels equal identifiers, except that roughly
     * one section in {@code unlabeledOneIn} has none, or none at all if it isn't positive. Roughly one section in four has blank content.
     */
    static List<Section> generateForest(final RandomGenerator random, final int unlabeledOneIn) {
        final var generator = new ForestGenerator(random, unlabeledOneIn);
        final var rootCount = random.nextInt(1, 5);
        final var roots = new ArrayList<Section>(rootCount);
        for (int i = 1; i <= rootCount; i += 1) {
            roots.add(generator.generate(Integer.toString(i), 0));
        }
        return roots;
    }

    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final class ForestGenerator {
        private ForestGenerator(final RandomGenerator random, final int unlabeledOneIn) {
            this.random = random;
            this.unlabeledOneIn = unlabeledOneIn;
        }

        private Section generate(final String identifier, final int depth) {
            final var childCount = (depth >= maxDepth) ? 0 : random.nextInt(0, 4);
            final var children = new ArrayList<Section>(childCount);
            for (int i = 1; i <= childCount; i += 1) {
                children.add(generate(identifier + '.' + i, depth + 1));
            }
            final @Nullable String label = (unlabeledOneIn > 0 && random.nextInt(unlabeledOneIn) == 0) ? null : "s" + identifier;
            final var content = (random.nextInt(4) == 0) ? "  \n " : "Text of " + identifier;
            return new Section(identifier, "Title " + identifier, content, label, children);
        }

        private static final int maxDepth = 4;

        private final RandomGenerator random;
        private final int unlabeledOneIn;
    }

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }
}
