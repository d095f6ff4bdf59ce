package com.so2flux.service.model.impl.smoothing;

/**
 * Savitzky-Golay smoothing: a least-squares polynomial of the given order is fitted to an
 * odd window around each sample and evaluated at the window centre. Samples beyond the
 * edges repeat the nearest edge value.
 *
 * <p>If the signal is shorter than the window, the window is clipped to the largest odd
 * length that fits, and the polynomial order is lowered to stay below the window.
 */
public class SavitzkyGolaySmoother {

    private final int window;
    private final int order;

    public SavitzkyGolaySmoother(int window, int order) {
        if (window < 1 || window % 2 == 0) {
            throw new IllegalArgumentException("Smoothing window must be a positive odd number, got " + window);
        }
        if (order < 0 || order >= window) {
            throw new IllegalArgumentException(
                    "Smoothing order must be in [0, window), got order " + order + " for window " + window);
        }
        this.window = window;
        this.order = order;
    }

    /**
     * @param length number of samples to smooth, must be positive
     * @return the window actually applied to a signal of that length
     */
    public int effectiveWindow(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Cannot smooth an empty signal");
        }
        if (window <= length) {
            return window;
        }
        return length % 2 == 1 ? length : length - 1;
    }

    public double[] smooth(double[] y) {
        int n = y.length;
        int w = effectiveWindow(n);
        int p = Math.min(order, w - 1);
        double[] coeffs = coefficients(w, p);
        int half = w / 2;

        double[] smoothed = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int j = 0; j < w; j++) {
                int idx = Math.min(Math.max(i + j - half, 0), n - 1);
                sum += coeffs[j] * y[idx];
            }
            smoothed[i] = sum;
        }
        return smoothed;
    }

    /**
     * Convolution coefficients that evaluate the fitted polynomial at the window centre.
     */
    static double[] coefficients(int window, int order) {
        int half = window / 2;
        int m = order + 1;

        // Vandermonde matrix over offsets -half..half
        double[][] a = new double[window][m];
        for (int i = 0; i < window; i++) {
            double x = i - half;
            double pow = 1;
            for (int k = 0; k < m; k++) {
                a[i][k] = pow;
                pow *= x;
            }
        }

        // Normal equations (A^T A) b = e0; the centre value is then a . b per row
        double[][] ata = new double[m][m];
        for (int r = 0; r < m; r++) {
            for (int c = 0; c < m; c++) {
                double sum = 0;
                for (int i = 0; i < window; i++) {
                    sum += a[i][r] * a[i][c];
                }
                ata[r][c] = sum;
            }
        }
        double[] e0 = new double[m];
        e0[0] = 1;
        double[] b = solve(ata, e0);

        double[] coeffs = new double[window];
        for (int i = 0; i < window; i++) {
            double sum = 0;
            for (int k = 0; k < m; k++) {
                sum += a[i][k] * b[k];
            }
            coeffs[i] = sum;
        }
        return coeffs;
    }

    // Gaussian elimination with partial pivoting; the system is small and well conditioned
    private static double[] solve(double[][] matrix, double[] rhs) {
        int m = rhs.length;
        double[][] a = new double[m][];
        for (int r = 0; r < m; r++) {
            a[r] = matrix[r].clone();
        }
        double[] b = rhs.clone();

        for (int col = 0; col < m; col++) {
            int pivot = col;
            for (int r = col + 1; r < m; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            double[] rowTmp = a[col];
            a[col] = a[pivot];
            a[pivot] = rowTmp;
            double bTmp = b[col];
            b[col] = b[pivot];
            b[pivot] = bTmp;

            for (int r = col + 1; r < m; r++) {
                double factor = a[r][col] / a[col][col];
                for (int c = col; c < m; c++) {
                    a[r][c] -= factor * a[col][c];
                }
                b[r] -= factor * b[col];
            }
        }

        double[] x = new double[m];
        for (int r = m - 1; r >= 0; r--) {
            double sum = b[r];
            for (int c = r + 1; c < m; c++) {
                sum -= a[r][c] * x[c];
            }
            x[r] = sum / a[r][r];
        }
        return x;
    }
}
