package my.allocationengine.app.service;

import my.allocationengine.app.config.AppProperties;
import my.allocationengine.app.domain.Allocation;
import my.allocationengine.app.domain.AllocationConstraints;
import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.EfficientFrontier;
import my.allocationengine.app.domain.FrontierPoint;
import my.allocationengine.app.error.EngineWarning;
import my.allocationengine.app.error.InfeasibleAllocationException;
import my.allocationengine.app.error.WarningCode;
import my.allocationengine.app.service.util.MatrixSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Long-only mean-variance optimiser: maximise μᵀw - λ·wᵀΣw - γ·‖w‖² subject to Σw = budget and
 * 0 ≤ w ≤ cap.
 */
public class PortfolioOptimizer {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioOptimizer.class);
	private static final double FRONTIER_TOLERANCE = 1e-9;
	private static final int MAX_RIDGE_ATTEMPTS = 12;
	private static final int TARGET_BISECTION_STEPS = 80;

	private final Settings settings;

	public PortfolioOptimizer(Settings settings) {
		this.settings = settings == null ? Settings.defaults() : settings;
	}

	public Settings settings() {
		return settings;
	}

	public OptimizationResult optimize(double[] mu, CovarianceMatrix covariance, double riskAversion) {
		return optimize(mu, covariance, riskAversion, AllocationConstraints.FULLY_INVESTED);
	}

	public OptimizationResult optimize(double[] mu,
									   CovarianceMatrix covariance,
									   double riskAversion,
									   AllocationConstraints constraints) {
		requireRiskAversion(riskAversion);
		Problem problem = prepare(mu, covariance, constraints);
		Solution solution = solve(problem, riskAversion);
		return toResult(problem, solution, riskAversion);
	}

	public EfficientFrontier frontier(double[] mu, CovarianceMatrix covariance) {
		return frontier(mu, covariance, AllocationConstraints.FULLY_INVESTED, riskAversionSweep());
	}

	public EfficientFrontier frontier(double[] mu,
									  CovarianceMatrix covariance,
									  AllocationConstraints constraints,
									  List<Double> riskAversions) {
		if (riskAversions == null || riskAversions.isEmpty()) {
			throw new IllegalArgumentException("At least one risk-aversion level is required");
		}
		Problem problem = prepare(mu, covariance, constraints);
		List<Double> sweep = riskAversions.stream().sorted().toList();
		List<FrontierPoint> raw = new ArrayList<>(sweep.size());
		for (double lambda : sweep) {
			requireRiskAversion(lambda);
			OptimizationResult result = toResult(problem, solve(problem, lambda), lambda);
			raw.add(new FrontierPoint(result.expectedReturn(), result.risk(), lambda, result.allocation()));
		}
		List<FrontierPoint> points = nonDominated(raw);
		logger.debug("Frontier sweep of {} risk-aversion levels kept {} non-dominated points", sweep.size(), points.size());
		return new EfficientFrontier(points, problem.warnings());
	}

	public OptimizationResult optimizeForTargetReturn(double[] mu,
													  CovarianceMatrix covariance,
													  double targetReturn,
													  AllocationConstraints constraints) {
		if (!Double.isFinite(targetReturn)) {
			throw new IllegalArgumentException("Target return must be finite");
		}
		Problem problem = prepare(mu, covariance, constraints);
		OptimizationResult best = toResult(problem, solve(problem, 0.0), 0.0);
		if (targetReturn > best.expectedReturn() + FRONTIER_TOLERANCE) {
			throw new InfeasibleAllocationException(String.format(Locale.ROOT,
					"Target return %.6f exceeds the best achievable return %.6f", targetReturn, best.expectedReturn()));
		}
		double high = settings.maxRiskAversion();
		OptimizationResult conservative = toResult(problem, solve(problem, high), high);
		if (conservative.expectedReturn() >= targetReturn - FRONTIER_TOLERANCE) {
			return conservative;
		}
		double low = settings.minRiskAversion() / 1000.0;
		OptimizationResult feasible = toResult(problem, solve(problem, low), low);
		if (feasible.expectedReturn() < targetReturn - FRONTIER_TOLERANCE) {
			return best;
		}
		for (int step = 0; step < TARGET_BISECTION_STEPS && high / low > 1.0 + 1e-9; step++) {
			double mid = Math.sqrt(low * high);
			OptimizationResult candidate = toResult(problem, solve(problem, mid), mid);
			if (candidate.expectedReturn() >= targetReturn - FRONTIER_TOLERANCE) {
				low = mid;
				feasible = candidate;
			} else {
				high = mid;
			}
		}
		return feasible;
	}

	public List<Double> riskAversionSweep() {
		int count = settings.frontierPoints();
		List<Double> sweep = new ArrayList<>(count + 1);
		sweep.add(0.0);
		double logMin = Math.log(settings.minRiskAversion());
		double logMax = Math.log(settings.maxRiskAversion());
		for (int i = 0; i < count; i++) {
			double fraction = count == 1 ? 0.0 : (double) i / (count - 1);
			sweep.add(Math.exp(logMin + fraction * (logMax - logMin)));
		}
		return List.copyOf(sweep);
	}

	static List<FrontierPoint> nonDominated(List<FrontierPoint> raw) {
		List<FrontierPoint> sorted = new ArrayList<>(raw);
		sorted.sort(Comparator.comparingDouble(FrontierPoint::risk)
				.thenComparing(Comparator.comparingDouble(FrontierPoint::expectedReturn).reversed())
				.thenComparingDouble(FrontierPoint::riskAversion));
		List<FrontierPoint> kept = new ArrayList<>();
		for (FrontierPoint point : sorted) {
			boolean dominated = false;
			for (FrontierPoint other : sorted) {
				if (other != point && other.dominates(point, FRONTIER_TOLERANCE)) {
					dominated = true;
					break;
				}
			}
			if (dominated) {
				continue;
			}
			// equally dominant points: the first one seen has the lower risk
			boolean duplicate = false;
			for (FrontierPoint existing : kept) {
				if (Math.abs(existing.expectedReturn() - point.expectedReturn()) <= FRONTIER_TOLERANCE
						&& Math.abs(existing.risk() - point.risk()) <= FRONTIER_TOLERANCE) {
					duplicate = true;
					break;
				}
			}
			if (!duplicate) {
				kept.add(point);
			}
		}
		return List.copyOf(kept);
	}

	private Problem prepare(double[] mu, CovarianceMatrix covariance, AllocationConstraints constraints) {
		if (mu == null || covariance == null) {
			throw new IllegalArgumentException("Returns and covariance are required");
		}
		AllocationConstraints resolved = constraints == null ? AllocationConstraints.FULLY_INVESTED : constraints;
		resolved.requireFeasible(mu.length);
		if (covariance.size() != mu.length) {
			throw new IllegalArgumentException("Return vector has " + mu.length + " entries, covariance has " + covariance.size());
		}
		for (double value : mu) {
			if (!Double.isFinite(value)) {
				throw new IllegalArgumentException("Expected returns must be finite");
			}
		}
		List<EngineWarning> warnings = new ArrayList<>();
		double[][] conditioned = condition(covariance, warnings);
		double maxEigenvalue = Math.max(0.0, MatrixSupport.eigenvalueRange(conditioned)[1]);
		return new Problem(mu.clone(), covariance, conditioned, maxEigenvalue, resolved, List.copyOf(warnings));
	}

	double[][] condition(CovarianceMatrix covariance, List<EngineWarning> warnings) {
		double[][] values = covariance.toArray();
		double threshold = settings.conditionThreshold();
		double original = MatrixSupport.conditionNumber(values);
		if (original <= threshold) {
			return values;
		}
		double[][] adjusted = values;
		double shrinkage = 0.0;
		while (shrinkage < 1.0 && MatrixSupport.conditionNumber(adjusted) > threshold) {
			shrinkage = Math.min(1.0, shrinkage + settings.shrinkageStep());
			adjusted = MatrixSupport.shrinkTowardDiagonal(values, shrinkage);
		}
		double ridge = 0.0;
		double scale = Math.max(covariance.meanVariance(), Double.MIN_NORMAL);
		double[][] shrunk = adjusted;
		for (int attempt = 0; attempt < MAX_RIDGE_ATTEMPTS && MatrixSupport.conditionNumber(adjusted) > threshold; attempt++) {
			ridge = ridge == 0.0 ? settings.ridge() * scale : ridge * 10.0;
			adjusted = MatrixSupport.addRidge(shrunk, ridge);
		}
		String message = String.format(Locale.ROOT,
				"Covariance condition number %.3g above %.3g; shrinkage=%.2f ridge=%.3g",
				original, threshold, shrinkage, ridge);
		logger.warn("Regularized covariance before solving: {}", message);
		warnings.add(EngineWarning.of(WarningCode.REGULARIZED_COVARIANCE, message));
		return adjusted;
	}

	private Solution solve(Problem problem, double riskAversion) {
		double curvature = 2.0 * (riskAversion * problem.maxEigenvalue() + settings.l2Gamma());
		if (curvature <= 0.0) {
			return new Solution(solveLinear(problem), 0);
		}
		return solveProjectedGradient(problem, riskAversion, curvature);
	}

	private double[] solveLinear(Problem problem) {
		int n = problem.mu().length;
		List<Integer> order = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			order.add(i);
		}
		order.sort(Comparator.<Integer>comparingDouble(i -> -problem.mu()[i])
				.thenComparingDouble(i -> problem.conditioned()[i][i])
				.thenComparingInt(i -> i));
		double[] weights = new double[n];
		double remaining = problem.constraints().budget();
		for (int index : order) {
			if (remaining <= 0.0) {
				break;
			}
			double weight = Math.min(problem.constraints().maxWeight(), remaining);
			weights[index] = weight;
			remaining -= weight;
		}
		return weights;
	}

	private Solution solveProjectedGradient(Problem problem, double riskAversion, double curvature) {
		int n = problem.mu().length;
		double budget = problem.constraints().budget();
		double cap = problem.constraints().maxWeight();
		double step = 1.0 / curvature;
		double[] start = new double[n];
		for (int i = 0; i < n; i++) {
			start[i] = budget / n;
		}
		double[] current = MatrixSupport.projectOntoCappedSimplex(start, budget, cap);
		double[] momentum = current.clone();
		double currentObjective = objective(problem, current, riskAversion);
		double t = 1.0;
		int iteration = 0;
		boolean restarted = false;
		while (iteration < settings.maxIterations()) {
			iteration++;
			double[] gradient = gradient(problem, momentum, riskAversion);
			double[] moved = new double[n];
			for (int i = 0; i < n; i++) {
				moved[i] = momentum[i] + step * gradient[i];
			}
			double[] next = MatrixSupport.projectOntoCappedSimplex(moved, budget, cap);
			double nextObjective = objective(problem, next, riskAversion);
			double change = maxAbsDifference(next, current);
			if (nextObjective < currentObjective && !restarted) {
				// restart the momentum when the objective went backwards; a plain step is always accepted
				t = 1.0;
				momentum = current.clone();
				restarted = true;
				continue;
			}
			restarted = false;
			double nextT = 0.5 * (1.0 + Math.sqrt(1.0 + 4.0 * t * t));
			double blend = (t - 1.0) / nextT;
			for (int i = 0; i < n; i++) {
				momentum[i] = next[i] + blend * (next[i] - current[i]);
			}
			current = next;
			currentObjective = nextObjective;
			t = nextT;
			if (change <= settings.tolerance()) {
				break;
			}
		}
		if (iteration >= settings.maxIterations()) {
			logger.debug("Projected gradient hit the iteration limit ({}) at lambda={}", iteration, riskAversion);
		}
		return new Solution(current, iteration);
	}

	private double[] gradient(Problem problem, double[] weights, double riskAversion) {
		int n = weights.length;
		double[][] sigma = problem.conditioned();
		double[] gradient = new double[n];
		for (int i = 0; i < n; i++) {
			double row = 0.0;
			for (int j = 0; j < n; j++) {
				row += sigma[i][j] * weights[j];
			}
			gradient[i] = problem.mu()[i] - 2.0 * riskAversion * row - 2.0 * settings.l2Gamma() * weights[i];
		}
		return gradient;
	}

	private double objective(Problem problem, double[] weights, double riskAversion) {
		int n = weights.length;
		double[][] sigma = problem.conditioned();
		double expected = 0.0;
		double quadratic = 0.0;
		double squaredNorm = 0.0;
		for (int i = 0; i < n; i++) {
			expected += problem.mu()[i] * weights[i];
			squaredNorm += weights[i] * weights[i];
			double row = 0.0;
			for (int j = 0; j < n; j++) {
				row += sigma[i][j] * weights[j];
			}
			quadratic += weights[i] * row;
		}
		return expected - riskAversion * quadratic - settings.l2Gamma() * squaredNorm;
	}

	private OptimizationResult toResult(Problem problem, Solution solution, double riskAversion) {
		double[] weights = solution.weights();
		double expected = 0.0;
		for (int i = 0; i < weights.length; i++) {
			expected += problem.mu()[i] * weights[i];
		}
		double risk = Math.sqrt(problem.covariance().portfolioVariance(weights));
		Allocation allocation = Allocation.fromArray(problem.covariance().ids(), weights);
		return new OptimizationResult(allocation, expected, risk, riskAversion, solution.iterations(), problem.warnings());
	}

	private static double maxAbsDifference(double[] a, double[] b) {
		double max = 0.0;
		for (int i = 0; i < a.length; i++) {
			max = Math.max(max, Math.abs(a[i] - b[i]));
		}
		return max;
	}

	private static void requireRiskAversion(double riskAversion) {
		if (!Double.isFinite(riskAversion) || riskAversion < 0.0) {
			throw new IllegalArgumentException("Risk aversion must be a finite, non-negative number, got " + riskAversion);
		}
	}

	public record OptimizationResult(Allocation allocation,
									 double expectedReturn,
									 double risk,
									 double riskAversion,
									 int iterations,
									 List<EngineWarning> warnings) {
		public OptimizationResult {
			warnings = warnings == null ? List.of() : List.copyOf(warnings);
		}

		public FrontierPoint toFrontierPoint() {
			return new FrontierPoint(expectedReturn, risk, riskAversion, allocation);
		}
	}

	public record Settings(double conditionThreshold,
						   double shrinkageStep,
						   double ridge,
						   int maxIterations,
						   double tolerance,
						   int frontierPoints,
						   double minRiskAversion,
						   double maxRiskAversion,
						   double l2Gamma,
						   double riskFreeRate,
						   double weightCutoff) {
		public static final double DEFAULT_CONDITION_THRESHOLD = 1e8;
		public static final double DEFAULT_SHRINKAGE_STEP = 0.1;
		public static final double DEFAULT_RIDGE = 1e-8;
		public static final int DEFAULT_MAX_ITERATIONS = 20_000;
		public static final double DEFAULT_TOLERANCE = 1e-12;
		public static final int DEFAULT_FRONTIER_POINTS = 30;
		public static final double DEFAULT_MIN_RISK_AVERSION = 0.01;
		public static final double DEFAULT_MAX_RISK_AVERSION = 1_000.0;
		public static final double DEFAULT_WEIGHT_CUTOFF = 1e-4;

		public Settings {
			if (minRiskAversion <= 0.0 || maxRiskAversion < minRiskAversion) {
				throw new IllegalArgumentException("Risk-aversion sweep needs 0 < min <= max");
			}
			if (frontierPoints < 1) {
				throw new IllegalArgumentException("Frontier needs at least one sweep point");
			}
			if (shrinkageStep <= 0.0 || shrinkageStep > 1.0) {
				throw new IllegalArgumentException("Shrinkage step must lie in (0, 1]");
			}
			if (l2Gamma < 0.0) {
				throw new IllegalArgumentException("L2 penalty must be non-negative");
			}
		}

		public static Settings defaults() {
			return new Settings(DEFAULT_CONDITION_THRESHOLD, DEFAULT_SHRINKAGE_STEP, DEFAULT_RIDGE,
					DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, DEFAULT_FRONTIER_POINTS,
					DEFAULT_MIN_RISK_AVERSION, DEFAULT_MAX_RISK_AVERSION, 0.0, 0.0, DEFAULT_WEIGHT_CUTOFF);
		}

		public static Settings from(AppProperties.Optimizer optimizer) {
			if (optimizer == null) {
				return defaults();
			}
			return new Settings(
					valueOr(optimizer.conditionThreshold(), DEFAULT_CONDITION_THRESHOLD),
					valueOr(optimizer.shrinkageStep(), DEFAULT_SHRINKAGE_STEP),
					valueOr(optimizer.ridge(), DEFAULT_RIDGE),
					optimizer.maxIterations() == null ? DEFAULT_MAX_ITERATIONS : optimizer.maxIterations(),
					valueOr(optimizer.tolerance(), DEFAULT_TOLERANCE),
					optimizer.frontierPoints() == null ? DEFAULT_FRONTIER_POINTS : optimizer.frontierPoints(),
					valueOr(optimizer.minRiskAversion(), DEFAULT_MIN_RISK_AVERSION),
					valueOr(optimizer.maxRiskAversion(), DEFAULT_MAX_RISK_AVERSION),
					valueOr(optimizer.l2Gamma(), 0.0),
					valueOr(optimizer.riskFreeRate(), 0.0),
					valueOr(optimizer.weightCutoff(), DEFAULT_WEIGHT_CUTOFF));
		}

		public Settings withL2Gamma(double gamma) {
			return new Settings(conditionThreshold, shrinkageStep, ridge, maxIterations, tolerance, frontierPoints,
					minRiskAversion, maxRiskAversion, gamma, riskFreeRate, weightCutoff);
		}

		private static double valueOr(Double value, double fallback) {
			return value == null ? fallback : value;
		}
	}

	private record Problem(double[] mu,
						   CovarianceMatrix covariance,
						   double[][] conditioned,
						   double maxEigenvalue,
						   AllocationConstraints constraints,
						   List<EngineWarning> warnings) {
	}

	private record Solution(double[] weights, int iterations) {
	}
}
