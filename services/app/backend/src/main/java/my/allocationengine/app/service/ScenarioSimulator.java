package my.allocationengine.app.service;

import jakarta.annotation.PreDestroy;
import my.allocationengine.app.config.AppProperties;
import my.allocationengine.app.domain.Allocation;
import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.Candidates;
import my.allocationengine.app.domain.OutcomeState;
import my.allocationengine.app.domain.SimulationResult;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.SimulationFailedException;
import my.allocationengine.app.error.WarningCode;
import my.allocationengine.app.service.simulation.ParametricTransitionModel;
import my.allocationengine.app.service.simulation.PayoffSchedule;
import my.allocationengine.app.service.simulation.SimulationRequest;
import my.allocationengine.app.service.simulation.TimeDecay;
import my.allocationengine.app.service.simulation.TransitionModel;
import my.allocationengine.app.service.simulation.TrialKernel;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ScenarioSimulator implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ScenarioSimulator.class);
	private static final double DEGENERATE_DISPERSION = 1e-12;

	private final Settings settings;
	private final ExecutorService executor;
	private final SecureRandom entropy = new SecureRandom();

	public ScenarioSimulator(Settings settings) {
		this.settings = settings == null ? Settings.defaults() : settings;
		this.executor = Executors.newFixedThreadPool(this.settings.parallelism(), new WorkerThreadFactory());
	}

	public Settings settings() {
		return settings;
	}

	public SimulationRequest defaultRequest() {
		return new SimulationRequest(
				settings.trials(),
				settings.horizon(),
				settings.transition(),
				settings.payoffs(),
				TimeDecay.ofHalfLife(settings.halfLife()),
				null,
				settings.percentiles(),
				null);
	}

	public SimulationResult simulate(Allocation allocation, List<Candidate> candidates, SimulationRequest request) {
		if (allocation == null || candidates == null || request == null) {
			throw new IllegalArgumentException("Allocation, candidates and request are required");
		}
		long runSeed = request.seed() != null ? request.seed() : entropy.nextLong();
		return run(allocation, candidates, request, runSeed);
	}

	public Map<String, SimulationResult> compareStrategies(Allocation allocation,
														   List<Candidate> candidates,
														   Map<String, TransitionModel> strategies,
														   SimulationRequest request) {
		if (strategies == null || strategies.isEmpty()) {
			return Map.of();
		}
		if (request == null) {
			throw new IllegalArgumentException("Simulation request is required");
		}
		long runSeed = request.seed() != null ? request.seed() : entropy.nextLong();
		Map<String, SimulationResult> results = new LinkedHashMap<>();
		for (Map.Entry<String, TransitionModel> entry : strategies.entrySet()) {
			SimulationRequest strategyRequest = request.withModel(entry.getValue()).withSeed(runSeed);
			results.put(entry.getKey(), simulate(allocation, candidates, strategyRequest));
		}
		return results;
	}

	@PreDestroy
	public void shutdown() {
		List<Runnable> pending = executor.shutdownNow();
		for (Runnable task : pending) {
			if (task instanceof Future<?> future) {
				future.cancel(true);
			}
		}
		if (!pending.isEmpty()) {
			logger.info("Scenario simulator shut down with {} queued chunks cancelled.", pending.size());
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	private SimulationResult run(Allocation allocation, List<Candidate> candidates, SimulationRequest request, long runSeed) {
		List<Candidate> validated = Candidates.validated(candidates);
		Set<String> ids = new HashSet<>(Candidates.ids(validated));
		for (String id : allocation.weights().keySet()) {
			if (!ids.contains(id)) {
				throw new IllegalArgumentException("Allocation references unknown candidate: " + id);
			}
		}
		List<Candidate> active = new ArrayList<>();
		List<Double> activeWeights = new ArrayList<>();
		for (Candidate candidate : validated) {
			double weight = allocation.weight(candidate.id());
			if (weight > 0.0) {
				active.add(candidate);
				activeWeights.add(weight);
			}
		}
		double[] weights = new double[activeWeights.size()];
		for (int i = 0; i < weights.length; i++) {
			weights[i] = activeWeights.get(i);
		}
		TrialKernel kernel = new TrialKernel(active, weights, request.horizon(), request.model(),
				request.payoffs(), request.decay(), runSeed);

		int trials = request.trials();
		logger.debug("Simulating {} trials over {} steps for {} funded candidates (seed={})",
				trials, request.horizon(), active.size(), runSeed);
		double[] values = new double[trials];
		long deadline = request.timeBudget() == null ? 0L : System.nanoTime() + request.timeBudget().toNanos();
		boolean bounded = request.timeBudget() != null;

		List<Future<ChunkTally>> futures = new ArrayList<>();
		List<ChunkTally> tallies = new ArrayList<>();
		try {
			for (int start = 0; start < trials; start += settings.chunkSize()) {
				int from = start;
				int to = Math.min(trials, start + settings.chunkSize());
				futures.add(executor.submit(() -> runChunk(kernel, values, from, to, bounded, deadline)));
			}
			for (Future<ChunkTally> future : futures) {
				tallies.add(future.get());
			}
		} catch (ExecutionException ex) {
			cancel(futures);
			throw failure(request, runSeed, ex.getCause() == null ? ex : ex.getCause());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			cancel(futures);
			throw failure(request, runSeed, ex);
		} catch (RejectedExecutionException | CancellationException ex) {
			cancel(futures);
			throw failure(request, runSeed, ex);
		}
		return aggregate(request, runSeed, kernel.candidateCount(), values, tallies);
	}

	private static ChunkTally runChunk(TrialKernel kernel, double[] values, int from, int to, boolean bounded, long deadline) {
		long[] stateCounts = new long[OutcomeState.values().length];
		long[] steps = new long[1];
		int completed = 0;
		for (int trial = from; trial < to; trial++) {
			if (bounded && System.nanoTime() - deadline > 0) {
				break;
			}
			if (Thread.currentThread().isInterrupted()) {
				break;
			}
			values[trial] = kernel.run(trial, stateCounts, steps);
			completed++;
		}
		return new ChunkTally(from, completed, stateCounts, steps[0]);
	}

	private SimulationResult aggregate(SimulationRequest request,
									   long runSeed,
									   int candidateCount,
									   double[] values,
									   List<ChunkTally> tallies) {
		int completed = 0;
		long[] stateCounts = new long[OutcomeState.values().length];
		long steps = 0L;
		for (ChunkTally tally : tallies) {
			completed += tally.completed();
			steps += tally.steps();
			for (int i = 0; i < stateCounts.length; i++) {
				stateCounts[i] += tally.stateCounts()[i];
			}
		}
		if (completed == 0) {
			throw failure(request, runSeed, new IllegalStateException("Time budget expired before any trial completed"));
		}
		double[] sample = new double[completed];
		int position = 0;
		for (ChunkTally tally : tallies) {
			System.arraycopy(values, tally.from(), sample, position, tally.completed());
			position += tally.completed();
		}
		if (completed < request.trials()) {
			logger.warn("Simulation time budget {} expired after {} of {} trials",
					request.timeBudget(), completed, request.trials());
		}

		DescriptiveStatistics statistics = new DescriptiveStatistics(sample);
		double mean = statistics.getMean();
		double standardDeviation = completed > 1 ? statistics.getStandardDeviation() : 0.0;
		double standardError = standardDeviation / Math.sqrt(completed);
		TreeMap<Double, Double> percentiles = new TreeMap<>();
		for (double p : request.percentiles()) {
			percentiles.put(p, statistics.getPercentile(p));
		}

		List<EngineWarning> warnings = new ArrayList<>();
		OptionalDouble sharpe;
		if (completed < 2 || standardDeviation <= DEGENERATE_DISPERSION * Math.max(1.0, Math.abs(mean))) {
			sharpe = OptionalDouble.empty();
			warnings.add(EngineWarning.of(WarningCode.DEGENERATE_RATIO,
					"Simulated values show no dispersion; the Sharpe-like ratio is undefined"));
		} else {
			sharpe = OptionalDouble.of(mean / standardDeviation);
		}

		Map<OutcomeState, Double> frequencies = new EnumMap<>(OutcomeState.class);
		double outcomes = (double) completed * candidateCount;
		for (OutcomeState state : OutcomeState.values()) {
			frequencies.put(state, outcomes == 0.0 ? 0.0 : stateCounts[state.ordinal()] / outcomes);
		}
		double meanSteps = outcomes == 0.0 ? 0.0 : steps / outcomes;

		return new SimulationResult(request.trials(), completed, runSeed, mean, standardDeviation, standardError,
				percentiles, sharpe, frequencies, meanSteps, warnings);
	}

	private static void cancel(List<Future<ChunkTally>> futures) {
		for (Future<ChunkTally> future : futures) {
			future.cancel(true);
		}
	}

	private static SimulationFailedException failure(SimulationRequest request, long runSeed, Throwable cause) {
		String message = cause == null ? null : cause.getMessage();
		String reference = "SIM-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Simulation failed (ref={}, trials={}, horizon={}, seed={}, error={})",
				reference, request.trials(), request.horizon(), runSeed, message, cause);
		return new SimulationFailedException("Simulation failed. Error ref " + reference, reference, cause);
	}

	private record ChunkTally(int from, int completed, long[] stateCounts, long steps) {
	}

	private static final class WorkerThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "scenario-sim-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	public record Settings(int trials,
						   int horizon,
						   Double halfLife,
						   int parallelism,
						   int chunkSize,
						   List<Double> percentiles,
						   TransitionModel transition,
						   PayoffSchedule payoffs) {
		public static final int DEFAULT_TRIALS = 10_000;
		public static final int DEFAULT_HORIZON = 30;
		public static final int DEFAULT_CHUNK_SIZE = 1_000;

		public Settings {
			if (trials < 1 || horizon < 1 || chunkSize < 1) {
				throw new IllegalArgumentException("Trials, horizon and chunk size must be positive");
			}
			if (halfLife != null && !(halfLife > 0.0)) {
				throw new IllegalArgumentException("Half-life must be positive");
			}
			parallelism = parallelism <= 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
			percentiles = percentiles == null || percentiles.isEmpty()
					? SimulationRequest.DEFAULT_PERCENTILES
					: List.copyOf(percentiles);
			transition = transition == null ? ParametricTransitionModel.DEFAULT : transition;
			payoffs = payoffs == null ? PayoffSchedule.DEFAULT : payoffs;
		}

		public static Settings defaults() {
			return new Settings(DEFAULT_TRIALS, DEFAULT_HORIZON, null, 0, DEFAULT_CHUNK_SIZE, null, null, null);
		}

		public static Settings from(AppProperties.Simulation simulation) {
			if (simulation == null) {
				return defaults();
			}
			return new Settings(
					simulation.trials() == null ? DEFAULT_TRIALS : simulation.trials(),
					simulation.horizon() == null ? DEFAULT_HORIZON : simulation.horizon(),
					simulation.halfLife(),
					simulation.parallelism() == null ? 0 : simulation.parallelism(),
					simulation.chunkSize() == null ? DEFAULT_CHUNK_SIZE : simulation.chunkSize(),
					simulation.percentiles(),
					ParametricTransitionModel.from(simulation.transition()),
					PayoffSchedule.from(simulation.payoff()));
		}

		public Settings withParallelism(int parallelism) {
			return new Settings(trials, horizon, halfLife, parallelism, chunkSize, percentiles, transition, payoffs);
		}

		public Settings withChunkSize(int chunkSize) {
			return new Settings(trials, horizon, halfLife, parallelism, chunkSize, percentiles, transition, payoffs);
		}
	}
}
