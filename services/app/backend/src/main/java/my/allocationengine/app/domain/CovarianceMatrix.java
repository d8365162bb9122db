package my.allocationengine.app.domain;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class CovarianceMatrix {
	private final List<String> ids;
	private final double[][] values;
	private final Map<String, Integer> index;

	private CovarianceMatrix(List<String> ids, double[][] values) {
		this.ids = List.copyOf(ids);
		this.values = values;
		Map<String, Integer> positions = new HashMap<>();
		for (int i = 0; i < this.ids.size(); i++) {
			if (positions.put(this.ids.get(i), i) != null) {
				throw new IllegalArgumentException("Duplicate id in covariance matrix: " + this.ids.get(i));
			}
		}
		this.index = Map.copyOf(positions);
	}

	public static CovarianceMatrix of(List<String> ids, double[][] values) {
		int n = ids == null ? 0 : ids.size();
		if (values == null || values.length != n) {
			throw new IllegalArgumentException("Covariance matrix must be " + n + "x" + n);
		}
		double[][] copy = new double[n][n];
		for (int i = 0; i < n; i++) {
			if (values[i] == null || values[i].length != n) {
				throw new IllegalArgumentException("Covariance matrix must be square");
			}
			for (int j = 0; j < n; j++) {
				if (!Double.isFinite(values[i][j])) {
					throw new IllegalArgumentException("Covariance matrix contains a non-finite value at " + i + "," + j);
				}
			}
		}
		for (int i = 0; i < n; i++) {
			if (values[i][i] < 0.0) {
				throw new IllegalArgumentException("Negative variance for " + ids.get(i));
			}
			copy[i][i] = values[i][i];
			for (int j = i + 1; j < n; j++) {
				double symmetric = 0.5 * (values[i][j] + values[j][i]);
				copy[i][j] = symmetric;
				copy[j][i] = symmetric;
			}
		}
		return new CovarianceMatrix(ids, copy);
	}

	public static CovarianceMatrix fromRisks(List<String> ids, double[] risks, double[][] correlations) {
		int n = ids.size();
		if (risks.length != n) {
			throw new IllegalArgumentException("Expected " + n + " risk values, got " + risks.length);
		}
		double[][] values = new double[n][n];
		for (int i = 0; i < n; i++) {
			values[i][i] = risks[i] * risks[i];
			for (int j = i + 1; j < n; j++) {
				double rho = correlations == null ? 0.0 : clampCorrelation(correlations[i][j]);
				double covariance = rho * risks[i] * risks[j];
				values[i][j] = covariance;
				values[j][i] = covariance;
			}
		}
		return new CovarianceMatrix(ids, values);
	}

	public static CovarianceMatrix diagonal(List<String> ids, double[] risks) {
		return fromRisks(ids, risks, null);
	}

	public static CovarianceMatrix fromRealMatrix(List<String> ids, RealMatrix matrix) {
		return of(ids, matrix.getData());
	}

	public int size() {
		return ids.size();
	}

	public List<String> ids() {
		return ids;
	}

	public int indexOf(String id) {
		Integer position = index.get(id);
		return position == null ? -1 : position;
	}

	public double get(int i, int j) {
		return values[i][j];
	}

	public double variance(int i) {
		return values[i][i];
	}

	public double risk(int i) {
		return Math.sqrt(values[i][i]);
	}

	public double correlation(int i, int j) {
		if (i == j) {
			return 1.0;
		}
		double denominator = Math.sqrt(values[i][i] * values[j][j]);
		if (denominator <= 0.0) {
			return 0.0;
		}
		return clampCorrelation(values[i][j] / denominator);
	}

	public double portfolioVariance(double[] weights) {
		if (weights.length != values.length) {
			throw new IllegalArgumentException("Weight vector has " + weights.length + " entries, expected " + values.length);
		}
		double total = 0.0;
		for (int i = 0; i < values.length; i++) {
			if (weights[i] == 0.0) {
				continue;
			}
			double row = 0.0;
			for (int j = 0; j < values.length; j++) {
				row += values[i][j] * weights[j];
			}
			total += weights[i] * row;
		}
		return Math.max(0.0, total);
	}

	public double meanVariance() {
		if (values.length == 0) {
			return 0.0;
		}
		double sum = 0.0;
		for (int i = 0; i < values.length; i++) {
			sum += values[i][i];
		}
		return sum / values.length;
	}

	public double[][] toArray() {
		double[][] copy = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			copy[i] = values[i].clone();
		}
		return copy;
	}

	public RealMatrix toRealMatrix() {
		return new Array2DRowRealMatrix(values, true);
	}

	private static double clampCorrelation(double rho) {
		if (Double.isNaN(rho)) {
			return 0.0;
		}
		return Math.max(-1.0, Math.min(1.0, rho));
	}
}
