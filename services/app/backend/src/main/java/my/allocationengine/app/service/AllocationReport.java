package my.allocationengine.app.service;

import my.allocationengine.app.domain.EfficientFrontier;
import my.allocationengine.app.domain.FrontierPoint;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.domain.SimulationResult;
import my.allocationengine.app.error.EngineWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record AllocationReport(RiskReturnEstimate estimate,
							   ViewBlender.BlendResult blend,
							   EfficientFrontier frontier,
							   PortfolioOptimizer.OptimizationResult chosen,
							   Optional<FrontierPoint> maxSharpe,
							   double riskFreeRate,
							   SimulationResult simulation,
							   Map<String, SimulationResult> strategyResults,
							   List<EngineWarning> warnings) {
	public AllocationReport {
		maxSharpe = maxSharpe == null ? Optional.empty() : maxSharpe;
		strategyResults = strategyResults == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(strategyResults));
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public boolean hasSimulation() {
		return simulation != null;
	}

	public Optional<String> bestStrategy() {
		String best = null;
		double bestMean = Double.NEGATIVE_INFINITY;
		for (Map.Entry<String, SimulationResult> entry : strategyResults.entrySet()) {
			if (entry.getValue().mean() > bestMean) {
				bestMean = entry.getValue().mean();
				best = entry.getKey();
			}
		}
		return Optional.ofNullable(best);
	}
}
