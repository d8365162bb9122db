package my.allocationengine.app.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CovarianceMatrixTest {
	private static final List<String> IDS = List.of("A", "B");

	@Test
	void symmetrisesRawInput() {
		CovarianceMatrix matrix = CovarianceMatrix.of(IDS, new double[][]{{0.04, 0.01}, {0.03, 0.09}});

		assertThat(matrix.get(0, 1)).isEqualTo(matrix.get(1, 0)).isCloseTo(0.02, within(1e-15));
	}

	@Test
	void buildsFromRisksWithClampedCorrelation() {
		CovarianceMatrix matrix = CovarianceMatrix.fromRisks(IDS, new double[]{0.2, 0.3},
				new double[][]{{1.0, 1.7}, {1.7, 1.0}});

		assertThat(matrix.variance(0)).isCloseTo(0.04, within(1e-15));
		assertThat(matrix.variance(1)).isCloseTo(0.09, within(1e-15));
		assertThat(matrix.correlation(0, 1)).isCloseTo(1.0, within(1e-12));
		assertThat(matrix.get(0, 1)).isCloseTo(0.06, within(1e-15));
	}

	@Test
	void portfolioVarianceIsQuadraticForm() {
		CovarianceMatrix matrix = CovarianceMatrix.fromRisks(IDS, new double[]{0.2, 0.1},
				new double[][]{{1.0, 0.5}, {0.5, 1.0}});

		double variance = matrix.portfolioVariance(new double[]{0.5, 0.5});

		// 0.25 * 0.04 + 0.25 * 0.01 + 2 * 0.25 * 0.5 * 0.2 * 0.1
		assertThat(variance).isCloseTo(0.0175, within(1e-15));
	}

	@Test
	void rejectsNonSquareAndNegativeVariance() {
		assertThatThrownBy(() -> CovarianceMatrix.of(IDS, new double[][]{{0.04, 0.0}}))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> CovarianceMatrix.of(IDS, new double[][]{{-0.04, 0.0}, {0.0, 0.01}}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Negative variance");
	}

	@Test
	void toArrayReturnsDefensiveCopy() {
		CovarianceMatrix matrix = CovarianceMatrix.diagonal(IDS, new double[]{0.2, 0.3});
		double[][] copy = matrix.toArray();
		copy[0][0] = 99.0;

		assertThat(matrix.variance(0)).isCloseTo(0.04, within(1e-15));
		assertThat(matrix.indexOf("B")).isEqualTo(1);
		assertThat(matrix.indexOf("missing")).isEqualTo(-1);
	}
}
