package my.allocationengine.app.service;

import my.allocationengine.app.domain.Allocation;
import my.allocationengine.app.domain.AllocationConstraints;
import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.Candidates;
import my.allocationengine.app.domain.CovarianceMatrix;
import my.allocationengine.app.domain.EfficientFrontier;
import my.allocationengine.app.domain.FrontierPoint;
import my.allocationengine.app.domain.RiskReturnEstimate;
import my.allocationengine.app.domain.SimulationResult;
import my.allocationengine.app.domain.View;
import my.allocationengine.app.service.correlation.CorrelationModel;
import my.allocationengine.app.service.simulation.SimulationRequest;
import my.allocationengine.app.service.simulation.TransitionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class AllocationEngineService {
	private static final Logger logger = LoggerFactory.getLogger(AllocationEngineService.class);
	private static final double FALLBACK_RISK_AVERSION = 1.0;

	private final RiskReturnEstimator estimator;
	private final ViewBlender blender;
	private final PortfolioOptimizer optimizer;
	private final ScenarioSimulator simulator;
	private final ReportAggregator aggregator;

	public AllocationEngineService(RiskReturnEstimator estimator,
								   ViewBlender blender,
								   PortfolioOptimizer optimizer,
								   ScenarioSimulator simulator,
								   ReportAggregator aggregator) {
		this.estimator = estimator;
		this.blender = blender;
		this.optimizer = optimizer;
		this.simulator = simulator;
		this.aggregator = aggregator;
	}

	public AllocationReport run(AllocationRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("Allocation request is required");
		}
		List<Candidate> candidates = Candidates.validated(request.candidates());
		RiskReturnEstimate estimate = request.correlationModel() == null
				? estimator.estimate(candidates)
				: estimator.estimate(candidates, request.correlationModel());
		CovarianceMatrix covariance = estimate.covariance();

		double[] prior = estimate.returns();
		if (request.impliedPrior() != null) {
			ImpliedPrior implied = request.impliedPrior();
			double[] reference = new Allocation(implied.referenceWeights()).toArray(estimate.ids());
			prior = blender.impliedPrior(covariance, reference, implied.riskAversion());
		}
		ViewBlender.BlendResult blend = blender.blend(prior, covariance, request.views());
		double[] posterior = blend.posterior();

		AllocationConstraints constraints = request.constraints() == null
				? AllocationConstraints.FULLY_INVESTED
				: request.constraints();
		EfficientFrontier frontier = optimizer.frontier(posterior, covariance, constraints, optimizer.riskAversionSweep());
		double riskFreeRate = optimizer.settings().riskFreeRate();
		PortfolioOptimizer.OptimizationResult chosen = choose(request, posterior, covariance, constraints, frontier, riskFreeRate);
		if (request.cleanWeights()) {
			chosen = cleaned(chosen, posterior, covariance);
		}

		SimulationResult simulation = null;
		Map<String, SimulationResult> strategies = Map.of();
		if (request.simulation() != null) {
			simulation = simulator.simulate(chosen.allocation(), candidates, request.simulation());
			if (request.strategies() != null && !request.strategies().isEmpty()) {
				strategies = simulator.compareStrategies(chosen.allocation(), candidates, request.strategies(),
						request.simulation().withSeed(simulation.seed()));
			}
		}

		AllocationReport report = aggregator.aggregate(estimate, blend, frontier, chosen, simulation, strategies, riskFreeRate);
		logger.info("Allocation run finished (candidates={}, views={}, frontierPoints={}, riskAversion={}, expectedReturn={}, risk={}, simulatedMean={}, warnings={})",
				candidates.size(),
				request.views() == null ? 0 : request.views().size(),
				frontier.points().size(),
				chosen.riskAversion(),
				chosen.expectedReturn(),
				chosen.risk(),
				simulation == null ? "n/a" : simulation.mean(),
				report.warnings().size());
		return report;
	}

	private PortfolioOptimizer.OptimizationResult choose(AllocationRequest request,
														 double[] posterior,
														 CovarianceMatrix covariance,
														 AllocationConstraints constraints,
														 EfficientFrontier frontier,
														 double riskFreeRate) {
		if (request.riskAversion() != null && request.targetReturn() != null) {
			throw new IllegalArgumentException("Specify either a risk aversion or a target return, not both");
		}
		if (request.targetReturn() != null) {
			return optimizer.optimizeForTargetReturn(posterior, covariance, request.targetReturn(), constraints);
		}
		if (request.riskAversion() != null) {
			return optimizer.optimize(posterior, covariance, request.riskAversion(), constraints);
		}
		Optional<FrontierPoint> maxSharpe = frontier.maxSharpe(riskFreeRate);
		double riskAversion = maxSharpe.map(FrontierPoint::riskAversion).orElse(FALLBACK_RISK_AVERSION);
		return optimizer.optimize(posterior, covariance, riskAversion, constraints);
	}

	private PortfolioOptimizer.OptimizationResult cleaned(PortfolioOptimizer.OptimizationResult result,
														  double[] posterior,
														  CovarianceMatrix covariance) {
		Allocation allocation = result.allocation().cleaned(optimizer.settings().weightCutoff());
		double[] weights = allocation.toArray(covariance.ids());
		double expectedReturn = 0.0;
		for (int i = 0; i < weights.length; i++) {
			expectedReturn += weights[i] * posterior[i];
		}
		double risk = Math.sqrt(Math.max(0.0, covariance.portfolioVariance(weights)));
		return new PortfolioOptimizer.OptimizationResult(allocation, expectedReturn, risk, result.riskAversion(),
				result.iterations(), result.warnings());
	}

	/**
	 * One engine run. Leave both {@code riskAversion} and {@code targetReturn} null to take the
	 * max-Sharpe point of the frontier; leave {@code simulation} null to skip the Monte Carlo step.
	 */
	public record AllocationRequest(List<Candidate> candidates,
									List<View> views,
									CorrelationModel correlationModel,
									Double riskAversion,
									Double targetReturn,
									AllocationConstraints constraints,
									ImpliedPrior impliedPrior,
									boolean cleanWeights,
									SimulationRequest simulation,
									Map<String, TransitionModel> strategies) {
		public AllocationRequest {
			views = views == null ? List.of() : List.copyOf(views);
			strategies = strategies == null ? Map.of() : strategies;
		}

		public static AllocationRequest of(List<Candidate> candidates, Double riskAversion) {
			return new AllocationRequest(candidates, List.of(), null, riskAversion, null, null, null, false, null, null);
		}
	}

	public record ImpliedPrior(Map<String, Double> referenceWeights, double riskAversion) {
	}
}
