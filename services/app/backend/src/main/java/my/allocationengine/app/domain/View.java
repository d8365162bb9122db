package my.allocationengine.app.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record View(Map<String, Double> targets, double value, double confidence) {
	public View {
		if (targets == null || targets.isEmpty()) {
			throw new IllegalArgumentException("A view needs at least one target");
		}
		Map<String, Double> copy = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : targets.entrySet()) {
			if (entry.getKey() == null || entry.getKey().isBlank()) {
				throw new IllegalArgumentException("View target id is required");
			}
			Double coefficient = entry.getValue();
			if (coefficient == null || !Double.isFinite(coefficient)) {
				throw new IllegalArgumentException("View coefficient for " + entry.getKey() + " must be finite");
			}
			copy.put(entry.getKey(), coefficient);
		}
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("View value must be finite");
		}
		if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("View confidence must be within [0, 1], got " + confidence);
		}
		targets = Collections.unmodifiableMap(copy);
	}

	public static View absolute(String candidateId, double value, double confidence) {
		return new View(Map.of(candidateId, 1.0), value, confidence);
	}

	public static View relative(String outperformer, String underperformer, double spread, double confidence) {
		if (outperformer != null && outperformer.equals(underperformer)) {
			throw new IllegalArgumentException("Relative view needs two distinct candidates, got " + outperformer + " twice");
		}
		Map<String, Double> targets = new LinkedHashMap<>();
		targets.put(outperformer, 1.0);
		targets.put(underperformer, -1.0);
		return new View(targets, spread, confidence);
	}
}
