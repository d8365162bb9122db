package my.allocationengine.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.allocationengine.app.domain.Allocation;
import my.allocationengine.app.domain.EfficientFrontier;
import my.allocationengine.app.domain.FrontierPoint;
import my.allocationengine.app.domain.OutcomeState;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.domain.SimulationResult;
import my.allocationengine.app.error.EngineWarning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

public class ReportAggregator {
	private final ObjectMapper objectMapper;

	public ReportAggregator(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
	}

	public AllocationReport aggregate(RiskReturnEstimate estimate,
									  ViewBlender.BlendResult blend,
									  EfficientFrontier frontier,
									  PortfolioOptimizer.OptimizationResult chosen,
									  SimulationResult simulation,
									  Map<String, SimulationResult> strategies,
									  double riskFreeRate) {
		if (estimate == null || blend == null || frontier == null || chosen == null) {
			throw new IllegalArgumentException("Estimate, blend, frontier and chosen allocation are required");
		}
		List<EngineWarning> strategyWarnings = new ArrayList<>();
		if (strategies != null) {
			for (SimulationResult result : strategies.values()) {
				strategyWarnings.addAll(result.warnings());
			}
		}
		List<EngineWarning> warnings = EngineWarning.merge(
				estimate.warnings(),
				blend.warnings(),
				frontier.warnings(),
				chosen.warnings(),
				simulation == null ? List.of() : simulation.warnings(),
				strategyWarnings);
		Optional<FrontierPoint> maxSharpe = frontier.maxSharpe(riskFreeRate);
		return new AllocationReport(estimate, blend, frontier, chosen, maxSharpe, riskFreeRate,
				simulation, strategies, warnings);
	}

	public Map<String, Object> toDocument(AllocationReport report) {
		Map<String, Object> document = new LinkedHashMap<>();
		document.put("candidates", candidates(report));
		document.put("allocation", chosen(report.chosen()));
		document.put("frontier", frontier(report.frontier(), report.riskFreeRate()));
		document.put("maxSharpe", report.maxSharpe().map(point -> point(point, report.riskFreeRate())).orElse(null));
		document.put("simulation", report.simulation() == null ? null : simulation(report.simulation()));
		Map<String, Object> strategies = new LinkedHashMap<>();
		for (Map.Entry<String, SimulationResult> entry : report.strategyResults().entrySet()) {
			strategies.put(entry.getKey(), simulation(entry.getValue()));
		}
		document.put("strategies", strategies);
		document.put("warnings", warnings(report.warnings()));
		return document;
	}

	public String toJson(AllocationReport report) {
		try {
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(report));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to render allocation report.", e);
		}
	}

	private List<Map<String, Object>> candidates(AllocationReport report) {
		List<String> ids = report.estimate().ids();
		double[] prior = report.blend().prior();
		double[] posterior = report.blend().posterior();
		List<Map<String, Object>> rows = new ArrayList<>();
		for (int i = 0; i < ids.size(); i++) {
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("id", ids.get(i));
			row.put("priorReturn", finiteOrNull(prior[i]));
			row.put("posteriorReturn", finiteOrNull(posterior[i]));
			row.put("risk", finiteOrNull(report.estimate().covariance().risk(i)));
			row.put("weight", report.chosen().allocation().weight(ids.get(i)));
			rows.add(row);
		}
		return rows;
	}

	private Map<String, Object> chosen(PortfolioOptimizer.OptimizationResult chosen) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put("riskAversion", finiteOrNull(chosen.riskAversion()));
		row.put("expectedReturn", finiteOrNull(chosen.expectedReturn()));
		row.put("risk", finiteOrNull(chosen.risk()));
		row.put("iterations", chosen.iterations());
		row.put("weights", weights(chosen.allocation()));
		return row;
	}

	private List<Map<String, Object>> frontier(EfficientFrontier frontier, double riskFreeRate) {
		List<Map<String, Object>> points = new ArrayList<>();
		for (FrontierPoint point : frontier.points()) {
			points.add(point(point, riskFreeRate));
		}
		return points;
	}

	private Map<String, Object> point(FrontierPoint point, double riskFreeRate) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put("expectedReturn", finiteOrNull(point.expectedReturn()));
		row.put("risk", finiteOrNull(point.risk()));
		row.put("riskAversion", finiteOrNull(point.riskAversion()));
		row.put("sharpeRatio", valueOrNull(point.sharpeRatio(riskFreeRate)));
		row.put("weights", weights(point.allocation()));
		return row;
	}

	private Map<String, Object> simulation(SimulationResult result) {
		Map<String, Object> row = new LinkedHashMap<>();
		row.put("trialsRequested", result.trialsRequested());
		row.put("trialsCompleted", result.trialsCompleted());
		row.put("partial", result.isPartial());
		row.put("seed", result.seed());
		row.put("mean", finiteOrNull(result.mean()));
		row.put("standardDeviation", finiteOrNull(result.standardDeviation()));
		row.put("standardError", finiteOrNull(result.standardError()));
		Map<String, Object> percentiles = new LinkedHashMap<>();
		for (Map.Entry<Double, Double> entry : result.percentiles().entrySet()) {
			percentiles.put(percentileKey(entry.getKey()), finiteOrNull(entry.getValue()));
		}
		row.put("percentiles", percentiles);
		row.put("sharpeRatio", valueOrNull(result.sharpeRatio()));
		Map<String, Object> frequencies = new LinkedHashMap<>();
		for (OutcomeState state : OutcomeState.values()) {
			frequencies.put(state.name().toLowerCase(Locale.ROOT), result.frequency(state));
		}
		row.put("terminalStateFrequencies", frequencies);
		row.put("meanStepsToTerminal", finiteOrNull(result.meanStepsToTerminal()));
		return row;
	}

	private static Map<String, Object> weights(Allocation allocation) {
		return new LinkedHashMap<>(allocation.weights());
	}

	private static List<Map<String, Object>> warnings(List<EngineWarning> warnings) {
		List<Map<String, Object>> rows = new ArrayList<>();
		for (EngineWarning warning : warnings) {
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("code", warning.code().id());
			row.put("message", warning.message());
			rows.add(row);
		}
		return rows;
	}

	static String percentileKey(double p) {
		if (p == Math.rint(p)) {
			return "p" + (long) p;
		}
		return "p" + String.valueOf(p).replace('.', '_');
	}

	private static Double finiteOrNull(double value) {
		return Double.isFinite(value) ? value : null;
	}

	private static Double valueOrNull(OptionalDouble value) {
		return value.isPresent() && Double.isFinite(value.getAsDouble()) ? value.getAsDouble() : null;
	}
}
