package my.allocationengine.app.domain;

import my.allocationengine.app.error.EngineWarning;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

public record EfficientFrontier(List<FrontierPoint> points, List<EngineWarning> warnings) {
	public EfficientFrontier {
		points = List.copyOf(points);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	public FrontierPoint minimumRisk() {
		return points.isEmpty() ? null : points.get(0);
	}

	public FrontierPoint maximumReturn() {
		return points.isEmpty() ? null : points.get(points.size() - 1);
	}

	public Optional<FrontierPoint> maxSharpe(double riskFreeRate) {
		FrontierPoint best = null;
		double bestRatio = Double.NEGATIVE_INFINITY;
		for (FrontierPoint point : points) {
			OptionalDouble ratio = point.sharpeRatio(riskFreeRate);
			if (ratio.isPresent() && ratio.getAsDouble() > bestRatio) {
				bestRatio = ratio.getAsDouble();
				best = point;
			}
		}
		return Optional.ofNullable(best);
	}

	public Optional<FrontierPoint> closestToRisk(double risk) {
		return points.stream()
				.min(Comparator.comparingDouble((FrontierPoint point) -> Math.abs(point.risk() - risk))
						.thenComparingDouble(FrontierPoint::risk));
	}
}
