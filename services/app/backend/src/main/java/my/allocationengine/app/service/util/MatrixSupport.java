package my.allocationengine.app.service.util;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;

public final class MatrixSupport {
	private static final int MAX_REGULARIZATION_ATTEMPTS = 6;
	private static final int PROJECTION_ITERATIONS = 200;

	private MatrixSupport() {
	}

	public static double[] eigenvalueRange(double[][] symmetric) {
		if (symmetric.length == 0) {
			return new double[]{0.0, 0.0};
		}
		double[] eigenvalues = new EigenDecomposition(new Array2DRowRealMatrix(symmetric, false)).getRealEigenvalues();
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double value : eigenvalues) {
			min = Math.min(min, value);
			max = Math.max(max, value);
		}
		return new double[]{min, max};
	}

	public static double conditionNumber(double[][] symmetric) {
		double[] range = eigenvalueRange(symmetric);
		if (range[0] <= 0.0 || range[1] <= 0.0) {
			return Double.POSITIVE_INFINITY;
		}
		return range[1] / range[0];
	}

	public static boolean isWellConditioned(double[][] symmetric, double threshold) {
		return conditionNumber(symmetric) <= threshold;
	}

	public static double[][] shrinkTowardDiagonal(double[][] matrix, double intensity) {
		double delta = Math.max(0.0, Math.min(1.0, intensity));
		int n = matrix.length;
		double[][] shrunk = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				shrunk[i][j] = i == j ? matrix[i][j] : (1.0 - delta) * matrix[i][j];
			}
		}
		return shrunk;
	}

	public static double[][] addRidge(double[][] matrix, double ridge) {
		int n = matrix.length;
		double[][] result = new double[n][];
		for (int i = 0; i < n; i++) {
			result[i] = matrix[i].clone();
			result[i][i] += ridge;
		}
		return result;
	}

	public static double meanDiagonal(RealMatrix matrix) {
		int n = matrix.getRowDimension();
		if (n == 0) {
			return 0.0;
		}
		return matrix.getTrace() / n;
	}

	public static InverseResult symmetricInverse(RealMatrix matrix, double tolerance, double regularization) {
		int n = matrix.getRowDimension();
		if (n == 0) {
			return new InverseResult(MatrixUtils.createRealMatrix(0, 0), false, 0.0);
		}
		RealMatrix symmetric = symmetrize(matrix);
		double meanDiagonal = meanDiagonal(symmetric);
		double scale = meanDiagonal > 0.0 ? meanDiagonal : 1.0;
		double ridge = 0.0;
		RealMatrix candidate = symmetric;
		for (int attempt = 0; attempt <= MAX_REGULARIZATION_ATTEMPTS; attempt++) {
			EigenDecomposition decomposition = new EigenDecomposition(candidate);
			double[] eigenvalues = decomposition.getRealEigenvalues();
			double max = Arrays.stream(eigenvalues).max().orElse(0.0);
			double min = Arrays.stream(eigenvalues).min().orElse(0.0);
			if (max > 0.0 && min > tolerance * max) {
				RealMatrix v = decomposition.getV();
				double[] inverted = new double[eigenvalues.length];
				for (int i = 0; i < eigenvalues.length; i++) {
					inverted[i] = 1.0 / eigenvalues[i];
				}
				RealMatrix inverse = v.multiply(MatrixUtils.createRealDiagonalMatrix(inverted)).multiply(v.transpose());
				return new InverseResult(symmetrize(inverse), ridge > 0.0, ridge);
			}
			ridge = ridge == 0.0 ? regularization * scale : ridge * 10.0;
			candidate = symmetric.add(MatrixUtils.createRealIdentityMatrix(n).scalarMultiply(ridge));
		}
		throw new ArithmeticException("Matrix could not be inverted even after regularization (ridge=" + ridge + ")");
	}

	public static RealMatrix symmetrize(RealMatrix matrix) {
		return matrix.add(matrix.transpose()).scalarMultiply(0.5);
	}

	/**
	 * Euclidean projection of {@code v} onto {w : Σw = budget, 0 ≤ w ≤ cap}, found by bisection on
	 * the shift τ in w = clamp(v - τ, 0, cap).
	 */
	public static double[] projectOntoCappedSimplex(double[] v, double budget, double cap) {
		int n = v.length;
		double low = Double.POSITIVE_INFINITY;
		double high = Double.NEGATIVE_INFINITY;
		for (double value : v) {
			low = Math.min(low, value);
			high = Math.max(high, value);
		}
		low -= cap;
		for (int iteration = 0; iteration < PROJECTION_ITERATIONS && high - low > 0.0; iteration++) {
			double mid = 0.5 * (low + high);
			if (mid == low || mid == high) {
				break;
			}
			if (clampedSum(v, mid, cap) > budget) {
				low = mid;
			} else {
				high = mid;
			}
		}
		double[] projected = new double[n];
		double total = 0.0;
		for (int i = 0; i < n; i++) {
			projected[i] = clamp(v[i] - high, cap);
			total += projected[i];
		}
		double residual = budget - total;
		if (residual > 0.0) {
			// Push the rounding residual into the coordinates that still have room below the cap.
			for (int i = 0; i < n && residual > 0.0; i++) {
				if (projected[i] > 0.0 && projected[i] < cap) {
					double room = Math.min(cap - projected[i], residual);
					projected[i] += room;
					residual -= room;
				}
			}
			for (int i = 0; i < n && residual > 0.0; i++) {
				double room = Math.min(cap - projected[i], residual);
				projected[i] += room;
				residual -= room;
			}
		}
		return projected;
	}

	private static double clampedSum(double[] v, double shift, double cap) {
		double total = 0.0;
		for (double value : v) {
			total += clamp(value - shift, cap);
		}
		return total;
	}

	private static double clamp(double value, double cap) {
		if (value <= 0.0) {
			return 0.0;
		}
		return Math.min(value, cap);
	}

	public record InverseResult(RealMatrix inverse, boolean regularized, double ridge) {
	}
}
