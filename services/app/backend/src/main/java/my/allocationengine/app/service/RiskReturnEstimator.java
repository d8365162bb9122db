package my.allocationengine.app.service;

import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.Candidates;
import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.InfeasibleAllocationException;
import my.allocationengine.app.error.WarningCode;
import my.allocationengine.app.service.correlation.CorrelationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class RiskReturnEstimator {
	private static final Logger logger = LoggerFactory.getLogger(RiskReturnEstimator.class);

	private final AlphaScorer scorer;
	private final CorrelationModel defaultModel;
	private final double maxAbsCorrelation;

	public RiskReturnEstimator(AlphaScorer scorer, CorrelationModel defaultModel, double maxAbsCorrelation) {
		this.scorer = Objects.requireNonNull(scorer, "scorer");
		this.defaultModel = Objects.requireNonNull(defaultModel, "defaultModel");
		if (!(maxAbsCorrelation >= 0.0 && maxAbsCorrelation <= 1.0)) {
			throw new IllegalArgumentException("Correlation cap must lie in [0, 1], got " + maxAbsCorrelation);
		}
		this.maxAbsCorrelation = maxAbsCorrelation;
	}

	public RiskReturnEstimate estimate(List<Candidate> candidates) {
		return estimate(candidates, defaultModel);
	}

	public RiskReturnEstimate estimate(List<Candidate> candidates, CorrelationModel model) {
		List<Candidate> validated = Candidates.validated(candidates);
		if (validated.isEmpty()) {
			throw new InfeasibleAllocationException("No candidates to estimate");
		}
		CorrelationModel correlationModel = model == null ? defaultModel : model;
		List<String> ids = Candidates.ids(validated);
		int n = validated.size();
		double[] returns = new double[n];
		double[] risks = new double[n];
		for (int i = 0; i < n; i++) {
			Candidate candidate = validated.get(i);
			double score = scorer.score(candidate);
			if (!Double.isFinite(score)) {
				throw new IllegalArgumentException("Scorer returned a non-finite score for " + candidate.id());
			}
			returns[i] = score;
			risks[i] = candidate.risk();
		}

		List<EngineWarning> warnings = new ArrayList<>();
		if (n < 2) {
			String message = "Only " + n + " candidate; using independent variances";
			logger.warn("Covariance estimation fell back to a diagonal matrix: {}", message);
			warnings.add(EngineWarning.of(WarningCode.INSUFFICIENT_DATA, message));
			return new RiskReturnEstimate(ids, returns, CovarianceMatrix.diagonal(ids, risks), warnings);
		}

		double[][] correlations = new double[n][n];
		int clamped = 0;
		for (int i = 0; i < n; i++) {
			correlations[i][i] = 1.0;
			for (int j = i + 1; j < n; j++) {
				double raw = correlationModel.correlation(validated.get(i), validated.get(j));
				double rho = clamp(raw);
				if (rho != raw) {
					clamped++;
				}
				correlations[i][j] = rho;
				correlations[j][i] = rho;
			}
		}
		if (clamped > 0) {
			String message = clamped + " correlation(s) outside [-" + maxAbsCorrelation + ", " + maxAbsCorrelation
					+ "] or non-finite were clamped";
			logger.warn("Correlation model {} produced out-of-range values: {}", correlationModel.name(), message);
			warnings.add(EngineWarning.of(WarningCode.CLAMPED_CORRELATION, message));
		}
		logger.debug("Estimated {}x{} covariance using {} correlations", n, n, correlationModel.name());
		return new RiskReturnEstimate(ids, returns, CovarianceMatrix.fromRisks(ids, risks, correlations), warnings);
	}

	private double clamp(double rho) {
		if (!Double.isFinite(rho)) {
			return 0.0;
		}
		return Math.max(-maxAbsCorrelation, Math.min(maxAbsCorrelation, rho));
	}
}
