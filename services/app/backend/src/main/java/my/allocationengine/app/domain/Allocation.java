package my.allocationengine.app.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Allocation(Map<String, Double> weights) {
	public static final double TOLERANCE = 1e-9;

	public Allocation {
		if (weights == null) {
			throw new IllegalArgumentException("Allocation weights are required");
		}
		Map<String, Double> copy = new LinkedHashMap<>();
		double total = 0.0;
		for (Map.Entry<String, Double> entry : weights.entrySet()) {
			String id = entry.getKey();
			Double raw = entry.getValue();
			if (id == null || raw == null || !Double.isFinite(raw)) {
				throw new IllegalArgumentException("Allocation contains a missing id or non-finite weight");
			}
			double weight = raw;
			if (weight < -TOLERANCE || weight > 1.0 + TOLERANCE) {
				throw new IllegalArgumentException("Weight for " + id + " outside [0, 1]: " + weight);
			}
			weight = Math.max(0.0, Math.min(1.0, weight));
			copy.put(id, weight);
			total += weight;
		}
		if (total > 1.0 + 1e-6) {
			throw new IllegalArgumentException("Allocation weights sum to " + total + ", above the budget of 1");
		}
		weights = Collections.unmodifiableMap(copy);
	}

	public static Allocation fromArray(List<String> ids, double[] values) {
		if (ids.size() != values.length) {
			throw new IllegalArgumentException("Expected " + ids.size() + " weights, got " + values.length);
		}
		Map<String, Double> weights = new LinkedHashMap<>();
		for (int i = 0; i < values.length; i++) {
			weights.put(ids.get(i), values[i]);
		}
		return new Allocation(weights);
	}

	public double weight(String id) {
		return weights.getOrDefault(id, 0.0);
	}

	public double total() {
		double total = 0.0;
		for (double weight : weights.values()) {
			total += weight;
		}
		return total;
	}

	public double[] toArray(List<String> ids) {
		double[] values = new double[ids.size()];
		for (int i = 0; i < ids.size(); i++) {
			values[i] = weight(ids.get(i));
		}
		return values;
	}

	public int activeCount() {
		int count = 0;
		for (double weight : weights.values()) {
			if (weight > 0.0) {
				count++;
			}
		}
		return count;
	}

	// Freed budget is not redistributed.
	public Allocation cleaned(double cutoff) {
		Map<String, Double> cleaned = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : weights.entrySet()) {
			double weight = entry.getValue();
			if (weight < cutoff) {
				cleaned.put(entry.getKey(), 0.0);
			} else {
				cleaned.put(entry.getKey(), Math.floor(weight * 1e5) / 1e5);
			}
		}
		return new Allocation(cleaned);
	}
}
