package my.allocationengine.app.service;

import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.error.ErrorCode;
import my.allocationengine.app.error.InfeasibleAllocationException;
import my.allocationengine.app.error.WarningCode;
import my.allocationengine.app.service.correlation.CorrelationModel;
import my.allocationengine.app.service.correlation.ExplicitCorrelationModel;
import my.allocationengine.app.service.correlation.FeatureDistanceCorrelationModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskReturnEstimatorTest {
	@Mock
	private AlphaScorer scorer;

	@Mock
	private CorrelationModel correlationModel;

	@Test
	void usesScorerForReturnsAndRisksForTheDiagonal() {
		when(scorer.score(any())).thenAnswer(invocation -> ((Candidate) invocation.getArgument(0)).expectedReturn() * 2.0);
		when(correlationModel.correlation(any(), any())).thenReturn(0.5);
		RiskReturnEstimator estimator = new RiskReturnEstimator(scorer, correlationModel, 0.99);

		RiskReturnEstimate estimate = estimator.estimate(List.of(
				Candidate.of("A", 0.1, 0.2),
				Candidate.of("B", 0.3, 0.4)));

		assertThat(estimate.returns()).containsExactly(0.2, 0.6);
		assertThat(estimate.covariance().variance(0)).isCloseTo(0.04, within(1e-15));
		assertThat(estimate.covariance().variance(1)).isCloseTo(0.16, within(1e-15));
		assertThat(estimate.covariance().get(0, 1)).isCloseTo(0.5 * 0.2 * 0.4, within(1e-15));
		assertThat(estimate.warnings()).isEmpty();
		verify(correlationModel, times(1)).correlation(any(), any());
	}

	@Test
	void singleCandidateFallsBackToDiagonalWithWarning() {
		when(scorer.score(any())).thenReturn(0.4);
		RiskReturnEstimator estimator = new RiskReturnEstimator(scorer, correlationModel, 0.99);

		RiskReturnEstimate estimate = estimator.estimate(List.of(Candidate.of("A", 0.4, 0.25)));

		assertThat(estimate.size()).isEqualTo(1);
		assertThat(estimate.covariance().variance(0)).isCloseTo(0.0625, within(1e-15));
		assertThat(estimate.warnings()).extracting(warning -> warning.code())
				.containsExactly(WarningCode.INSUFFICIENT_DATA);
		verifyNoInteractions(correlationModel);
	}

	@Test
	void emptyCandidateListIsInfeasible() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(scorer, correlationModel, 0.99);

		assertThatThrownBy(() -> estimator.estimate(List.of()))
				.isInstanceOf(InfeasibleAllocationException.class)
				.satisfies(ex -> assertThat(((InfeasibleAllocationException) ex).getErrorCode()).isEqualTo(ErrorCode.INFEASIBLE));
	}

	@Test
	void rejectsDuplicateIds() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(scorer, correlationModel, 0.99);

		assertThatThrownBy(() -> estimator.estimate(List.of(Candidate.of("A", 0.1, 0.1), Candidate.of("A", 0.2, 0.1))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("unique");
	}

	@Test
	void rejectsNonFiniteScores() {
		when(scorer.score(any())).thenReturn(Double.NaN);
		RiskReturnEstimator estimator = new RiskReturnEstimator(scorer, correlationModel, 0.99);

		assertThatThrownBy(() -> estimator.estimate(List.of(Candidate.of("A", 0.1, 0.1), Candidate.of("B", 0.2, 0.1))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("non-finite");
	}

	@Test
	void clampsCorrelationsToConfiguredCap() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(AlphaScorer.CANDIDATE_ESTIMATE,
				ExplicitCorrelationModel.builder().put("A", "B", 1.0).build(), 0.9);

		RiskReturnEstimate estimate = estimator.estimate(List.of(Candidate.of("A", 0.1, 0.2), Candidate.of("B", 0.2, 0.2)));

		assertThat(estimate.covariance().correlation(0, 1)).isCloseTo(0.9, within(1e-12));
		assertThat(estimate.warnings()).extracting(warning -> warning.code())
				.containsExactly(WarningCode.CLAMPED_CORRELATION);
	}

	@Test
	void perfectCorrelationPassesThroughUnderFullCap() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(AlphaScorer.CANDIDATE_ESTIMATE,
				ExplicitCorrelationModel.builder().put("A", "B", 1.0).build(), 1.0);

		RiskReturnEstimate estimate = estimator.estimate(List.of(Candidate.of("A", 0.1, 0.2), Candidate.of("B", 0.2, 0.2)));

		assertThat(estimate.covariance().correlation(0, 1)).isCloseTo(1.0, within(1e-12));
		assertThat(estimate.warnings()).isEmpty();
	}

	@Test
	void featureDistanceCorrelationDecaysWithDistance() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(AlphaScorer.CANDIDATE_ESTIMATE,
				new FeatureDistanceCorrelationModel(1.0), 0.99);

		RiskReturnEstimate estimate = estimator.estimate(List.of(
				new Candidate("A", 0.1, 0.2, List.of(0.0, 0.0)),
				new Candidate("B", 0.1, 0.2, List.of(0.3, 0.4)),
				new Candidate("C", 0.1, 0.2, List.of(3.0, 4.0)),
				Candidate.of("D", 0.1, 0.2)));

		assertThat(estimate.covariance().correlation(0, 1)).isCloseTo(Math.exp(-0.5), within(1e-12));
		assertThat(estimate.covariance().correlation(0, 2)).isCloseTo(Math.exp(-5.0), within(1e-12));
		assertThat(estimate.covariance().correlation(0, 1)).isGreaterThan(estimate.covariance().correlation(0, 2));
		assertThat(estimate.covariance().correlation(0, 3)).isZero();
	}

	@Test
	void overrideModelTakesPrecedenceOverDefault() {
		RiskReturnEstimator estimator = new RiskReturnEstimator(AlphaScorer.CANDIDATE_ESTIMATE, correlationModel, 0.99);

		RiskReturnEstimate estimate = estimator.estimate(
				List.of(Candidate.of("A", 0.1, 0.2), Candidate.of("B", 0.2, 0.3)),
				ExplicitCorrelationModel.builder().put("B", "A", -0.4).build());

		assertThat(estimate.covariance().correlation(1, 0)).isCloseTo(-0.4, within(1e-12));
		verifyNoInteractions(correlationModel);
	}
}
