package org.netcoord.runtime.internal.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.DoubleStream;

import org.netcoord.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SeededRandomProviderTest {

    private static double[] draw(IRandomProvider random, int count) {
        return DoubleStream.generate(random::nextDouble).limit(count).toArray();
    }

    @Test
    void sameSeedGivesSameStream() {
        assertThat(draw(new SeededRandomProvider(42L), 10)).containsExactly(draw(new SeededRandomProvider(42L), 10));
    }

    @Test
    void derivedStreamsAreReproducibleAndDistinct() {
        SeededRandomProvider parent = new SeededRandomProvider(42L);

        double[] fading = draw(parent.deriveFor("fading:mmwave", 0), 5);

        assertThat(draw(new SeededRandomProvider(42L).deriveFor("fading:mmwave", 0), 5)).containsExactly(fading);
        assertThat(draw(parent.deriveFor("fading:sub6", 0), 5)).isNotEqualTo(fading);
        assertThat(draw(parent.deriveFor("fading:mmwave", 1), 5)).isNotEqualTo(fading);
        assertThat(draw(new SeededRandomProvider(43L).deriveFor("fading:mmwave", 0), 5)).isNotEqualTo(fading);
    }

    @Test
    void derivingDoesNotConsumeTheParentStream() {
        SeededRandomProvider parent = new SeededRandomProvider(7L);
        parent.deriveFor("delegate:cell", 0).nextDouble();

        assertThat(draw(parent, 3)).containsExactly(draw(new SeededRandomProvider(7L), 3));
    }

    @Test
    void javaRandomViewSharesTheStream() {
        SeededRandomProvider provider = new SeededRandomProvider(9L);
        double first = provider.asJavaRandom().nextDouble();

        assertThat(new SeededRandomProvider(9L).nextDouble()).isEqualTo(first);
    }
}
