package my.allocationengine.app.service.correlation;

import my.allocationengine.app.domain.Candidate;

import java.util.HashMap;
import java.util.Map;

public final class ExplicitCorrelationModel implements CorrelationModel {
	private final Map<Pair, Double> correlations;

	private ExplicitCorrelationModel(Map<Pair, Double> correlations) {
		this.correlations = Map.copyOf(correlations);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public double correlation(Candidate first, Candidate second) {
		return correlations.getOrDefault(Pair.of(first.id(), second.id()), 0.0);
	}

	@Override
	public String name() {
		return "explicit";
	}

	public static final class Builder {
		private final Map<Pair, Double> correlations = new HashMap<>();

		private Builder() {
		}

		public Builder put(String first, String second, double correlation) {
			if (first == null || second == null || first.equals(second)) {
				throw new IllegalArgumentException("Correlation needs two distinct candidate ids");
			}
			if (!Double.isFinite(correlation) || correlation < -1.0 || correlation > 1.0) {
				throw new IllegalArgumentException("Correlation must lie in [-1, 1], got " + correlation);
			}
			correlations.put(Pair.of(first, second), correlation);
			return this;
		}

		public ExplicitCorrelationModel build() {
			return new ExplicitCorrelationModel(correlations);
		}
	}

	private record Pair(String low, String high) {
		static Pair of(String a, String b) {
			return a.compareTo(b) <= 0 ? new Pair(a, b) : new Pair(b, a);
		}
	}
}
