package my.allocationengine.app.service.correlation;

import my.allocationengine.app.domain.Candidate;

import java.util.List;

public final class FeatureDistanceCorrelationModel implements CorrelationModel {
	public static final double DEFAULT_LENGTH_SCALE = 1.0;

	private final double lengthScale;

	public FeatureDistanceCorrelationModel(double lengthScale) {
		if (!Double.isFinite(lengthScale) || lengthScale <= 0.0) {
			throw new IllegalArgumentException("Length scale must be positive, got " + lengthScale);
		}
		this.lengthScale = lengthScale;
	}

	public double lengthScale() {
		return lengthScale;
	}

	@Override
	public double correlation(Candidate first, Candidate second) {
		List<Double> a = first.features();
		List<Double> b = second.features();
		if (a.isEmpty() || b.isEmpty() || a.size() != b.size()) {
			return 0.0;
		}
		double squared = 0.0;
		for (int i = 0; i < a.size(); i++) {
			double diff = a.get(i) - b.get(i);
			squared += diff * diff;
		}
		return Math.exp(-Math.sqrt(squared) / lengthScale);
	}

	@Override
	public String name() {
		return "feature_distance";
	}
}
