package plumetracer.domain.field;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReducerTest {

    private static final double[] SAMPLES = {4.0, Double.NaN, 10.0, 1.0};

    @Test
    @DisplayName("Las reducciones ignoran las muestras sin dato")
    void reduce_skipsMissingSamples() {
        assertThat(Reducer.MEAN.reduce(SAMPLES)).isCloseTo(5.0, within(1e-12));
        assertThat(Reducer.MIN.reduce(SAMPLES)).isEqualTo(1.0);
        assertThat(Reducer.MAX.reduce(SAMPLES)).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Una celda sin ninguna muestra válida sigue sin dato")
    void reduce_allMissing_returnsNaN() {
        double[] empty = {Double.NaN, Double.NaN};

        assertThat(Reducer.MEAN.reduce(empty)).isNaN();
        assertThat(Reducer.MIN.reduce(empty)).isNaN();
        assertThat(Reducer.MAX.reduce(empty)).isNaN();
    }

    @Test
    @DisplayName("fromName acepta los nombres de la línea de comandos y rechaza los desconocidos")
    void fromName_parsesCommandLineNames() {
        assertThat(Reducer.fromName("mean")).isEqualTo(Reducer.MEAN);
        assertThat(Reducer.fromName(" Max ")).isEqualTo(Reducer.MAX);

        assertThatThrownBy(() -> Reducer.fromName("median"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
    }
}
