package my.allocationengine.app.service;

import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.View;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ViewBlenderTest {
	private static final List<String> IDS = List.of("A", "B", "C");
	private static final double[] PRIOR = {0.08, 0.05, 0.02};

	private final ViewBlender blender = new ViewBlender(ViewBlender.Settings.defaults());
	private final CovarianceMatrix covariance = CovarianceMatrix.fromRisks(IDS, new double[]{0.3, 0.2, 0.1},
			new double[][]{{1.0, 0.3, 0.1}, {0.3, 1.0, 0.2}, {0.1, 0.2, 1.0}});

	@Test
	void noViewsReturnsPriorUnchanged() {
		ViewBlender.BlendResult result = blender.blend(PRIOR, covariance, List.of());

		assertThat(result.posterior()).containsExactly(PRIOR);
		assertThat(result.warnings()).isEmpty();
	}

	@Test
	void fullConfidenceAbsoluteViewPinsPosterior() {
		ViewBlender.BlendResult result = blender.blend(PRIOR, covariance, List.of(View.absolute("B", 0.15, 1.0)));

		assertThat(result.posterior()[1]).isCloseTo(0.15, within(1e-5));
		assertThat(result.prior()).containsExactly(PRIOR);
	}

	@Test
	void fullConfidenceViewConvergesForAnyTau() {
		for (double tau : new double[]{0.5, 0.05, 0.001}) {
			ViewBlender.BlendResult result = blender.blend(PRIOR, covariance, List.of(View.absolute("A", -0.1, 1.0)), tau);

			assertThat(result.posterior()[0]).isCloseTo(-0.1, within(1e-5));
		}
	}

	@Test
	void zeroConfidenceViewLeavesPriorAlmostUntouched() {
		ViewBlender.BlendResult result = blender.blend(PRIOR, covariance, List.of(View.absolute("C", 0.5, 0.0)));

		assertThat(result.posterior()[2]).isCloseTo(PRIOR[2], within(1e-5));
	}

	@Test
	void higherConfidenceMovesPosteriorCloserToView() {
		double low = blender.blend(PRIOR, covariance, List.of(View.absolute("C", 0.10, 0.25))).posterior()[2];
		double high = blender.blend(PRIOR, covariance, List.of(View.absolute("C", 0.10, 0.75))).posterior()[2];

		assertThat(low).isGreaterThan(PRIOR[2]);
		assertThat(high).isGreaterThan(low).isLessThan(0.10);
	}

	@Test
	void relativeViewWidensSpreadAndSpillsOverToCorrelatedCandidates() {
		ViewBlender.BlendResult result = blender.blend(PRIOR, covariance, List.of(View.relative("C", "A", 0.04, 0.9)));
		double[] posterior = result.posterior();

		assertThat(posterior[2] - posterior[0]).isGreaterThan(PRIOR[2] - PRIOR[0]);
		assertThat(posterior[2] - posterior[0]).isCloseTo(0.04, within(0.02));
	}

	@Test
	void unknownViewTargetIsRejected() {
		assertThatThrownBy(() -> blender.blend(PRIOR, covariance, List.of(View.absolute("Z", 0.1, 0.5))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Z");
	}

	@Test
	void singularPriorCovarianceIsRegularisedWithWarning() {
		CovarianceMatrix singular = CovarianceMatrix.of(List.of("A", "B"), new double[][]{{0.04, 0.04}, {0.04, 0.04}});

		ViewBlender.BlendResult result = blender.blend(new double[]{0.05, 0.05}, singular,
				List.of(View.absolute("A", 0.08, 0.5)));

		assertThat(result.warnings()).extracting(EngineWarning::code).contains(WarningCode.SINGULAR_BLEND);
		for (double value : result.posterior()) {
			assertThat(value).isFinite();
		}
	}

	@Test
	void impliedPriorIsRiskAversionTimesCovarianceTimesWeights() {
		double[] weights = {0.5, 0.3, 0.2};

		double[] implied = blender.impliedPrior(covariance, weights, 2.5);

		for (int i = 0; i < IDS.size(); i++) {
			double expected = 0.0;
			for (int j = 0; j < IDS.size(); j++) {
				expected += covariance.get(i, j) * weights[j];
			}
			assertThat(implied[i]).isCloseTo(2.5 * expected, within(1e-15));
		}
	}

	@Test
	void rejectsMismatchedPrior() {
		assertThatThrownBy(() -> blender.blend(new double[]{0.1}, covariance, List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
