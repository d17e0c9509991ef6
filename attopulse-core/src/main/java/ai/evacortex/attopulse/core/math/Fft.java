/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.math;

/**
 * In-place iterative radix-2 FFT over split real/imaginary arrays.
 */
public final class Fft {

    private Fft() {}

    public static int nextPowerOfTwo(int n) {
        if (n <= 1) return 1;
        int p = Integer.highestOneBit(n - 1) << 1;
        if (p <= 0) {
            throw new IllegalArgumentException("FFT length overflow for n=" + n);
        }
        return p;
    }

    /**
     * Forward ({@code e^{-2πikn/N}}) or inverse transform. The inverse is scaled by {@code 1/N}.
     *
     * @throws IllegalArgumentException if the length is not a power of two
     */
    public static void transform(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        if (im.length != n) {
            throw new IllegalArgumentException("Mismatched lengths: " + n + " vs " + im.length);
        }
        if (n == 0 || (n & (n - 1)) != 0) {
            throw new IllegalArgumentException("FFT length must be a power of 2: " + n);
        }

        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double tr = re[i]; re[i] = re[j]; re[j] = tr;
                double ti = im[i]; im[i] = im[j]; im[j] = ti;
            }
        }

        double sign = inverse ? 1.0 : -1.0;
        for (int len = 2; len <= n; len <<= 1) {
            double angle = sign * 2.0 * Math.PI / len;
            double wr = Math.cos(angle);
            double wi = Math.sin(angle);
            int half = len >> 1;
            for (int start = 0; start < n; start += len) {
                double cr = 1.0;
                double ci = 0.0;
                for (int k = 0; k < half; k++) {
                    int a = start + k;
                    int b = a + half;
                    double br = re[b] * cr - im[b] * ci;
                    double bi = re[b] * ci + im[b] * cr;
                    re[b] = re[a] - br;
                    im[b] = im[a] - bi;
                    re[a] += br;
                    im[a] += bi;
                    double next = cr * wr - ci * wi;
                    ci = cr * wi + ci * wr;
                    cr = next;
                }
            }
        }

        if (inverse) {
            for (int i = 0; i < n; i++) {
                re[i] /= n;
                im[i] /= n;
            }
        }
    }
}
