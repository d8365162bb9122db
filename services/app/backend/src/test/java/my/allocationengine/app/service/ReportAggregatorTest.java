package my.allocationengine.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.allocationengine.app.domain.Allocation;
import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.EfficientFrontier;
import my.allocationengine.app.domain.FrontierPoint;
import my.allocationengine.app.domain.OutcomeState;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.domain.SimulationResult;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportAggregatorTest {
	private static final List<String> IDS = List.of("A", "B");
	private static final EngineWarning REGULARIZED = EngineWarning.of(WarningCode.REGULARIZED_COVARIANCE, "ridge");

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final ReportAggregator aggregator = new ReportAggregator(objectMapper);

	@Test
	void mergesWarningsWithoutDuplicates() {
		AllocationReport report = report(simulation(OptionalDouble.empty(),
				List.of(EngineWarning.of(WarningCode.DEGENERATE_RATIO, "flat"))));

		assertThat(report.warnings()).extracting(EngineWarning::code)
				.containsExactly(WarningCode.INSUFFICIENT_DATA, WarningCode.REGULARIZED_COVARIANCE, WarningCode.DEGENERATE_RATIO);
	}

	@Test
	void picksMaxSharpeFromFrontier() {
		AllocationReport report = report(null);

		assertThat(report.maxSharpe()).isPresent();
		assertThat(report.maxSharpe().get().expectedReturn()).isEqualTo(0.10);
		assertThat(report.hasSimulation()).isFalse();
	}

	@Test
	void jsonRendersUndefinedRatiosAsNull() throws Exception {
		AllocationReport report = report(simulation(OptionalDouble.empty(), List.of()));

		JsonNode json = objectMapper.readTree(aggregator.toJson(report));

		assertThat(json.get("simulation").get("sharpeRatio").isNull()).isTrue();
		assertThat(json.get("frontier").get(0).get("sharpeRatio").isNull()).isTrue();
		assertThat(json.get("frontier").get(1).get("sharpeRatio").asDouble()).isEqualTo(1.0);
		assertThat(json.get("simulation").get("percentiles").get("p50").asDouble()).isEqualTo(0.4);
		assertThat(json.get("simulation").get("terminalStateFrequencies").get("converted").asDouble()).isEqualTo(0.4);
		assertThat(json.get("warnings").get(0).get("code").asText()).isEqualTo("insufficient_data");
	}

	@Test
	void documentListsCandidatesWithPriorPosteriorAndWeight() {
		Map<String, Object> document = aggregator.toDocument(report(null));

		@SuppressWarnings("unchecked")
		List<Map<String, Object>> candidates = (List<Map<String, Object>>) document.get("candidates");
		assertThat(candidates).hasSize(2);
		assertThat(candidates.get(0)).containsEntry("id", "A")
				.containsEntry("priorReturn", 0.05)
				.containsEntry("posteriorReturn", 0.06)
				.containsEntry("weight", 0.6);
		assertThat(document.get("simulation")).isNull();
		assertThat(document.get("strategies")).isEqualTo(Map.of());
	}

	@Test
	void percentileKeysAreReadable() {
		assertThat(ReportAggregator.percentileKey(5.0)).isEqualTo("p5");
		assertThat(ReportAggregator.percentileKey(97.5)).isEqualTo("p97_5");
	}

	@Test
	void requiresCoreResults() {
		assertThatThrownBy(() -> aggregator.aggregate(null, null, null, null, null, null, 0.0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private AllocationReport report(SimulationResult simulation) {
		CovarianceMatrix covariance = CovarianceMatrix.diagonal(IDS, new double[]{0.1, 0.2});
		RiskReturnEstimate estimate = new RiskReturnEstimate(IDS, new double[]{0.05, 0.03}, covariance,
				List.of(EngineWarning.of(WarningCode.INSUFFICIENT_DATA, "thin")));
		ViewBlender.BlendResult blend = new ViewBlender.BlendResult(IDS, new double[]{0.05, 0.03},
				new double[]{0.06, 0.03}, List.of());
		Allocation safe = Allocation.fromArray(IDS, new double[]{0.0, 1.0});
		Allocation mixed = Allocation.fromArray(IDS, new double[]{0.6, 0.4});
		EfficientFrontier frontier = new EfficientFrontier(List.of(
				new FrontierPoint(0.0, 0.0, 100.0, safe),
				new FrontierPoint(0.10, 0.10, 1.0, mixed)), List.of(REGULARIZED));
		PortfolioOptimizer.OptimizationResult chosen = new PortfolioOptimizer.OptimizationResult(mixed, 0.048, 0.1, 1.0,
				12, List.of(REGULARIZED));
		return aggregator.aggregate(estimate, blend, frontier, chosen, simulation, Map.of(), 0.0);
	}

	private static SimulationResult simulation(OptionalDouble sharpe, List<EngineWarning> warnings) {
		TreeMap<Double, Double> percentiles = new TreeMap<>();
		percentiles.put(50.0, 0.4);
		EnumMap<OutcomeState, Double> frequencies = new EnumMap<>(OutcomeState.class);
		frequencies.put(OutcomeState.CONVERTED, 0.4);
		frequencies.put(OutcomeState.LAPSED, 0.6);
		return new SimulationResult(100, 100, 1L, 0.4, 0.0, 0.0, percentiles, sharpe, frequencies, 4.0, warnings);
	}
}
