package my.allocationengine.app.service.util;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MatrixSupportTest {
	@Test
	void projectionRespectsCapsAndBudget() {
		Well19937c random = new Well19937c(7L);
		for (int round = 0; round < 200; round++) {
			int n = 2 + random.nextInt(12);
			double cap = Math.max(1.0 / n, random.nextDouble());
			double budget = Math.min(1.0, cap * n) * (0.2 + 0.8 * random.nextDouble());
			double[] v = new double[n];
			for (int i = 0; i < n; i++) {
				v[i] = random.nextGaussian() * 3.0;
			}

			double[] projected = MatrixSupport.projectOntoCappedSimplex(v, budget, cap);

			assertThat(Arrays.stream(projected).sum()).isCloseTo(budget, within(1e-9));
			for (double weight : projected) {
				assertThat(weight).isBetween(0.0, cap + 1e-12);
			}
		}
	}

	@Test
	void projectionOfFeasiblePointIsIdentity() {
		double[] point = {0.2, 0.3, 0.5};

		double[] projected = MatrixSupport.projectOntoCappedSimplex(point, 1.0, 1.0);

		assertThat(projected[0]).isCloseTo(0.2, within(1e-9));
		assertThat(projected[1]).isCloseTo(0.3, within(1e-9));
		assertThat(projected[2]).isCloseTo(0.5, within(1e-9));
	}

	@Test
	void conditionNumberExplodesForSingularMatrix() {
		double[][] singular = {{1.0, 1.0}, {1.0, 1.0}};

		assertThat(MatrixSupport.conditionNumber(singular)).isGreaterThan(1e12);
		assertThat(MatrixSupport.conditionNumber(new double[][]{{1.0, 0.0}, {0.0, 0.0}})).isInfinite();
		assertThat(MatrixSupport.isWellConditioned(new double[][]{{2.0, 0.0}, {0.0, 1.0}}, 10.0)).isTrue();
	}

	@Test
	void shrinkageKeepsDiagonalAndScalesOffDiagonal() {
		double[][] shrunk = MatrixSupport.shrinkTowardDiagonal(new double[][]{{4.0, 2.0}, {2.0, 9.0}}, 0.25);

		assertThat(shrunk[0][0]).isEqualTo(4.0);
		assertThat(shrunk[1][1]).isEqualTo(9.0);
		assertThat(shrunk[0][1]).isEqualTo(1.5);
	}

	@Test
	void symmetricInverseRegularisesSingularInput() {
		RealMatrix singular = new Array2DRowRealMatrix(new double[][]{{1.0, 1.0}, {1.0, 1.0}});

		MatrixSupport.InverseResult result = MatrixSupport.symmetricInverse(singular, 1e-12, 1e-8);

		assertThat(result.regularized()).isTrue();
		assertThat(result.ridge()).isPositive();
		assertThat(result.inverse().getEntry(0, 1)).isEqualTo(result.inverse().getEntry(1, 0));
	}

	@Test
	void symmetricInverseOfWellConditionedMatrixIsExact() {
		RealMatrix matrix = new Array2DRowRealMatrix(new double[][]{{2.0, 0.0}, {0.0, 4.0}});

		MatrixSupport.InverseResult result = MatrixSupport.symmetricInverse(matrix, 1e-12, 1e-8);

		assertThat(result.regularized()).isFalse();
		assertThat(result.inverse().getEntry(0, 0)).isCloseTo(0.5, within(1e-12));
		assertThat(result.inverse().getEntry(1, 1)).isCloseTo(0.25, within(1e-12));
	}

	@Test
	void symmetricInverseOfZeroMatrixUsesAbsoluteRidge() {
		RealMatrix zero = new Array2DRowRealMatrix(2, 2);

		MatrixSupport.InverseResult result = MatrixSupport.symmetricInverse(zero, 1e-12, 1e-8);

		assertThat(result.regularized()).isTrue();
		assertThat(result.ridge()).isEqualTo(1e-8);
		assertThat(result.inverse().getEntry(0, 0)).isCloseTo(1e8, within(1.0));
	}
}
