package my.allocationengine.app.domain;

import java.util.OptionalDouble;

public record FrontierPoint(double expectedReturn, double risk, double riskAversion, Allocation allocation) {
	public OptionalDouble sharpeRatio(double riskFreeRate) {
		if (!(risk > 0.0)) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of((expectedReturn - riskFreeRate) / risk);
	}

	public boolean dominates(FrontierPoint other, double tolerance) {
		boolean noWorse = expectedReturn >= other.expectedReturn - tolerance && risk <= other.risk + tolerance;
		boolean better = expectedReturn > other.expectedReturn + tolerance || risk < other.risk - tolerance;
		return noWorse && better;
	}
}
