package my.allocationengine.app.domain;

import my.allocationengine.app.error.EngineWarning;

import java.util.List;

public record RiskReturnEstimate(List<String> ids,
								 double[] returns,
								 CovarianceMatrix covariance,
								 List<EngineWarning> warnings) {
	public RiskReturnEstimate {
		ids = List.copyOf(ids);
		returns = returns.clone();
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
		if (returns.length != ids.size() || covariance.size() != ids.size()) {
			throw new IllegalArgumentException("Estimate dimensions do not match the candidate count");
		}
	}

	@Override
	public double[] returns() {
		return returns.clone();
	}

	public int size() {
		return ids.size();
	}
}
