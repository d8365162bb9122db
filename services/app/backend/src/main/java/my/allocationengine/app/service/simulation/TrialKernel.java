package my.allocationengine.app.service.simulation;

import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.OutcomeState;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.List;

public final class TrialKernel {
	private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

	private final List<Candidate> candidates;
	private final double[] weights;
	private final int horizon;
	private final TransitionModel model;
	private final PayoffSchedule payoffs;
	private final TimeDecay decay;
	private final long runSeed;

	public TrialKernel(List<Candidate> candidates,
					   double[] weights,
					   int horizon,
					   TransitionModel model,
					   PayoffSchedule payoffs,
					   TimeDecay decay,
					   long runSeed) {
		if (candidates.size() != weights.length) {
			throw new IllegalArgumentException("Expected one weight per candidate");
		}
		this.candidates = List.copyOf(candidates);
		this.weights = weights.clone();
		this.horizon = horizon;
		this.model = model;
		this.payoffs = payoffs;
		this.decay = decay;
		this.runSeed = runSeed;
	}

	public int candidateCount() {
		return candidates.size();
	}

	public double run(int index, long[] stateCounts, long[] stepsOut) {
		RandomGenerator random = new Well19937c(trialSeed(runSeed, index));
		double value = 0.0;
		long steps = 0L;
		for (int i = 0; i < candidates.size(); i++) {
			Candidate candidate = candidates.get(i);
			OutcomeState state = OutcomeState.PROSPECT;
			int elapsed = horizon;
			for (int step = 0; step < horizon; step++) {
				double lapse = model.lapseProbability(state, candidate, step);
				double advance = model.advanceProbability(state, candidate, step);
				double u = random.nextDouble();
				if (u < lapse) {
					state = OutcomeState.LAPSED;
				} else if (u < lapse + (1.0 - lapse) * advance) {
					state = state.next();
				}
				if (state.isTerminal()) {
					elapsed = step + 1;
					break;
				}
			}
			stateCounts[state.ordinal()]++;
			steps += elapsed;
			value += weights[i] * payoffs.payoff(state) * decay.factor(elapsed);
		}
		stepsOut[0] += steps;
		return value;
	}

	static long trialSeed(long runSeed, int index) {
		long z = runSeed + (index + 1L) * GOLDEN_GAMMA;
		z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
		z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
		return z ^ (z >>> 31);
	}
}
