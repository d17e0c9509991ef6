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
 * Linear convolution of complex signals with a fixed real, odd-length kernel through zero-padded FFTs.
 * The output is cropped to the signal length and centered on the full convolution.
 *
 * <p>The kernel spectrum is computed once, so one instance serves every row of a time-frequency map.
 * Instances are immutable and may be shared between threads.</p>
 */
public final class FftConvolver {

    private final int signalLength;
    private final int offset;
    private final int paddedLength;
    private final double[] kernelRe;
    private final double[] kernelIm;

    public FftConvolver(double[] kernel, int signalLength) {
        if (kernel.length == 0 || signalLength <= 0) {
            throw new IllegalArgumentException("kernel and signal must be non-empty");
        }
        this.signalLength = signalLength;
        this.offset = (kernel.length - 1) / 2;
        this.paddedLength = Fft.nextPowerOfTwo(signalLength + kernel.length - 1);
        this.kernelRe = new double[paddedLength];
        this.kernelIm = new double[paddedLength];
        System.arraycopy(kernel, 0, kernelRe, 0, kernel.length);
        Fft.transform(kernelRe, kernelIm, false);
    }

    /**
     * Convolves {@code (re, im)} with the kernel and multiplies the result by {@code scale}.
     *
     * @return {@code [real part, imaginary part]}, each of the signal length
     */
    public double[][] convolveSame(double[] re, double[] im, double scale) {
        if (re.length != signalLength || im.length != signalLength) {
            throw new IllegalArgumentException("Expected signal length " + signalLength + ", got " + re.length);
        }
        double[] pr = new double[paddedLength];
        double[] pi = new double[paddedLength];
        System.arraycopy(re, 0, pr, 0, signalLength);
        System.arraycopy(im, 0, pi, 0, signalLength);
        Fft.transform(pr, pi, false);

        for (int k = 0; k < paddedLength; k++) {
            double r = pr[k] * kernelRe[k] - pi[k] * kernelIm[k];
            double i = pr[k] * kernelIm[k] + pi[k] * kernelRe[k];
            pr[k] = r;
            pi[k] = i;
        }
        Fft.transform(pr, pi, true);

        double[] outRe = new double[signalLength];
        double[] outIm = new double[signalLength];
        for (int n = 0; n < signalLength; n++) {
            outRe[n] = pr[n + offset] * scale;
            outIm[n] = pi[n + offset] * scale;
        }
        return new double[][]{outRe, outIm};
    }

    public int signalLength() {
        return signalLength;
    }
}
