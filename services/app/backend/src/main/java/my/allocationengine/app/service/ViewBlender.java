package my.allocationengine.app.service;

import my.allocationengine.app.config.AppProperties;
import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.View;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.WarningCode;
import my.allocationengine.app.service.util.MatrixSupport;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ViewBlender {
	private static final Logger logger = LoggerFactory.getLogger(ViewBlender.class);

	private final Settings settings;

	public ViewBlender(Settings settings) {
		this.settings = settings == null ? Settings.defaults() : settings;
	}

	public Settings settings() {
		return settings;
	}

	public BlendResult blend(double[] prior, CovarianceMatrix covariance, List<View> views) {
		return blend(prior, covariance, views, settings.tau());
	}

	public BlendResult blend(double[] prior, CovarianceMatrix covariance, List<View> views, double tau) {
		if (prior == null || covariance == null) {
			throw new IllegalArgumentException("Prior and covariance are required");
		}
		int n = covariance.size();
		if (prior.length != n) {
			throw new IllegalArgumentException("Prior has " + prior.length + " entries, covariance has " + n);
		}
		if (!Double.isFinite(tau) || tau <= 0.0) {
			throw new IllegalArgumentException("Tau must be positive, got " + tau);
		}
		if (views == null || views.isEmpty()) {
			return new BlendResult(covariance.ids(), prior, prior, List.of());
		}

		int k = views.size();
		RealMatrix sigma = covariance.toRealMatrix();
		RealMatrix tauSigma = sigma.scalarMultiply(tau);
		RealMatrix pick = new Array2DRowRealMatrix(k, n);
		RealVector viewReturns = new ArrayRealVector(k);
		for (int row = 0; row < k; row++) {
			View view = views.get(row);
			for (Map.Entry<String, Double> target : view.targets().entrySet()) {
				int column = covariance.indexOf(target.getKey());
				if (column < 0) {
					throw new IllegalArgumentException("View targets unknown candidate " + target.getKey());
				}
				pick.addToEntry(row, column, target.getValue());
			}
			viewReturns.setEntry(row, view.value());
		}

		List<EngineWarning> warnings = new ArrayList<>();
		double[] omegaInverse = new double[k];
		for (int row = 0; row < k; row++) {
			RealVector p = pick.getRowVector(row);
			double scaledViewVariance = tauSigma.preMultiply(p).dotProduct(p);
			omegaInverse[row] = 1.0 / viewUncertainty(scaledViewVariance, views.get(row).confidence(), row, warnings);
		}

		MatrixSupport.InverseResult priorPrecision = invert(tauSigma, "prior covariance", warnings);
		RealMatrix pickTransposed = pick.transpose();
		RealMatrix viewPrecision = pickTransposed.multiply(MatrixUtils.createRealDiagonalMatrix(omegaInverse));
		RealMatrix system = priorPrecision.inverse().add(viewPrecision.multiply(pick));
		RealVector rhs = priorPrecision.inverse().operate(new ArrayRealVector(prior))
				.add(viewPrecision.operate(viewReturns));
		MatrixSupport.InverseResult systemInverse = invert(system, "posterior system", warnings);
		double[] posterior = systemInverse.inverse().operate(rhs).toArray();

		logger.debug("Blended {} views into {} posterior returns (tau={})", k, n, tau);
		return new BlendResult(covariance.ids(), prior, posterior, warnings);
	}

	public double[] impliedPrior(CovarianceMatrix covariance, double[] referenceWeights, double riskAversion) {
		if (referenceWeights == null || referenceWeights.length != covariance.size()) {
			throw new IllegalArgumentException("Reference weights must match the covariance dimension");
		}
		if (!Double.isFinite(riskAversion) || riskAversion < 0.0) {
			throw new IllegalArgumentException("Risk aversion must be a non-negative number");
		}
		return covariance.toRealMatrix().operate(new ArrayRealVector(referenceWeights))
				.mapMultiply(riskAversion)
				.toArray();
	}

	/**
	 * Ω_kk = pᵀτΣp · (1 - c) / c with c clamped to [minConfidence, 1 - minConfidence], so lower
	 * confidence always means larger uncertainty and the entry stays finite.
	 */
	private double viewUncertainty(double scaledViewVariance, double confidence, int row, List<EngineWarning> warnings) {
		double c = Math.max(settings.minConfidence(), Math.min(1.0 - settings.minConfidence(), confidence));
		double omega = scaledViewVariance * (1.0 - c) / c;
		if (omega > 0.0 && Double.isFinite(omega)) {
			return omega;
		}
		String message = "View " + row + " has zero variance; uncertainty floored at " + settings.singularTolerance();
		logger.warn("Singular view uncertainty: {}", message);
		warnings.add(EngineWarning.of(WarningCode.SINGULAR_BLEND, message));
		return settings.singularTolerance();
	}

	private MatrixSupport.InverseResult invert(RealMatrix matrix, String label, List<EngineWarning> warnings) {
		MatrixSupport.InverseResult result = MatrixSupport.symmetricInverse(matrix,
				settings.singularTolerance(), settings.regularization());
		if (result.regularized()) {
			String message = "Inverse of the " + label + " needed a Tikhonov ridge of " + result.ridge();
			logger.warn("Singular blend: {}", message);
			warnings.add(EngineWarning.of(WarningCode.SINGULAR_BLEND, message));
		}
		return result;
	}

	public record Settings(double tau, double minConfidence, double regularization, double singularTolerance) {
		public static final double DEFAULT_TAU = 0.05;
		public static final double DEFAULT_MIN_CONFIDENCE = 1e-6;
		public static final double DEFAULT_REGULARIZATION = 1e-8;
		public static final double DEFAULT_SINGULAR_TOLERANCE = 1e-12;

		public static Settings defaults() {
			return new Settings(DEFAULT_TAU, DEFAULT_MIN_CONFIDENCE, DEFAULT_REGULARIZATION, DEFAULT_SINGULAR_TOLERANCE);
		}

		public static Settings from(AppProperties.Blender blender) {
			if (blender == null) {
				return defaults();
			}
			return new Settings(
					blender.tau() == null ? DEFAULT_TAU : blender.tau(),
					blender.minConfidence() == null ? DEFAULT_MIN_CONFIDENCE : blender.minConfidence(),
					blender.regularization() == null ? DEFAULT_REGULARIZATION : blender.regularization(),
					blender.singularTolerance() == null ? DEFAULT_SINGULAR_TOLERANCE : blender.singularTolerance());
		}
	}

	public record BlendResult(List<String> ids, double[] prior, double[] posterior, List<EngineWarning> warnings) {
		public BlendResult {
			ids = List.copyOf(ids);
			prior = prior.clone();
			posterior = posterior.clone();
			warnings = warnings == null ? List.of() : List.copyOf(warnings);
		}

		@Override
		public double[] prior() {
			return prior.clone();
		}

		@Override
		public double[] posterior() {
			return posterior.clone();
		}
	}
}
