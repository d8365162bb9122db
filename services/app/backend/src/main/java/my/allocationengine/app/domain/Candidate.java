package my.allocationengine.app.domain;

import java.util.List;
import java.util.Objects;

public record Candidate(String id, double expectedReturn, double risk, List<Double> features) {
	public Candidate {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Candidate id is required");
		}
		if (!Double.isFinite(expectedReturn)) {
			throw new IllegalArgumentException("Candidate " + id + " has a non-finite expected return");
		}
		if (!Double.isFinite(risk) || risk < 0.0) {
			throw new IllegalArgumentException("Candidate " + id + " needs a finite, non-negative risk");
		}
		if (features == null) {
			features = List.of();
		} else {
			for (Double feature : features) {
				if (feature == null || !Double.isFinite(feature)) {
					throw new IllegalArgumentException("Candidate " + id + " has a missing or non-finite feature");
				}
			}
			features = List.copyOf(features);
		}
	}

	public static Candidate of(String id, double expectedReturn, double risk) {
		return new Candidate(id, expectedReturn, risk, List.of());
	}

	public double variance() {
		return risk * risk;
	}

	public boolean hasFeatures() {
		return !features.isEmpty();
	}

	public Candidate withExpectedReturn(double value) {
		if (Double.compare(value, expectedReturn) == 0) {
			return this;
		}
		return new Candidate(id, value, risk, features);
	}

	static void requireUniqueIds(List<Candidate> candidates) {
		Objects.requireNonNull(candidates, "candidates");
		long distinct = candidates.stream().map(Candidate::id).distinct().count();
		if (distinct != candidates.size()) {
			throw new IllegalArgumentException("Candidate ids must be unique");
		}
	}
}
