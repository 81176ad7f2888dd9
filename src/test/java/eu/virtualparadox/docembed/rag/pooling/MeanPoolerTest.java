package eu.virtualparadox.docembed.rag.pooling;

import eu.virtualparadox.docembed.error.EncodeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MeanPoolerTest {

    private final MeanPooler pooler = new MeanPooler();

    @Test
    @DisplayName("Averages every channel over all tokens")
    void meanOverTokens() {
        float[][][] hidden = {{
                {1f, 2f, 3f},
                {3f, 4f, 5f},
                {5f, 0f, -2f}
        }};

        float[] pooled = pooler.pool(hidden, 3);

        assertThat(pooled[0]).isCloseTo(3f, within(1e-6f));
        assertThat(pooled[1]).isCloseTo(2f, within(1e-6f));
        assertThat(pooled[2]).isCloseTo(2f, within(1e-6f));
    }

    @Test
    @DisplayName("Single token is returned as is")
    void singleToken() {
        float[][][] hidden = {{{0.25f, -1.5f}}};
        assertThat(pooler.pool(hidden, 2)).containsExactly(0.25f, -1.5f);
    }

    @Test
    @DisplayName("Wrong batch size, empty sequence or wrong channel count are encode errors")
    void shapeErrors() {
        assertThatThrownBy(() -> pooler.pool(new float[2][1][2], 2)).isInstanceOf(EncodeException.class);
        assertThatThrownBy(() -> pooler.pool(new float[1][0][2], 2)).isInstanceOf(EncodeException.class);
        assertThatThrownBy(() -> pooler.pool(new float[1][3][4], 2)).isInstanceOf(EncodeException.class);
        assertThatThrownBy(() -> pooler.pool(null, 2)).isInstanceOf(EncodeException.class);
    }
}
