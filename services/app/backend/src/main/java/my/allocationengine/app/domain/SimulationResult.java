package my.allocationengine.app.domain;

import my.allocationengine.app.error.EngineWarning;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

public record SimulationResult(int trialsRequested,
							   int trialsCompleted,
							   long seed,
							   double mean,
							   double standardDeviation,
							   double standardError,
							   SortedMap<Double, Double> percentiles,
							   OptionalDouble sharpeRatio,
							   Map<OutcomeState, Double> terminalStateFrequencies,
							   double meanStepsToTerminal,
							   List<EngineWarning> warnings) {
	public SimulationResult {
		percentiles = Collections.unmodifiableSortedMap(new TreeMap<>(percentiles));
		EnumMap<OutcomeState, Double> frequencies = new EnumMap<>(OutcomeState.class);
		frequencies.putAll(terminalStateFrequencies);
		terminalStateFrequencies = Collections.unmodifiableMap(frequencies);
		sharpeRatio = sharpeRatio == null ? OptionalDouble.empty() : sharpeRatio;
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public boolean isPartial() {
		return trialsCompleted < trialsRequested;
	}

	public double percentile(double p) {
		Double value = percentiles.get(p);
		if (value == null) {
			throw new IllegalArgumentException("Percentile " + p + " was not computed");
		}
		return value;
	}

	public double frequency(OutcomeState state) {
		return terminalStateFrequencies.getOrDefault(state, 0.0);
	}
}
