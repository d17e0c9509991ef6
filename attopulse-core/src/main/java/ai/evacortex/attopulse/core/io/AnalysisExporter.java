/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.io;

import ai.evacortex.attopulse.core.gabor.TimeFrequencyMap;
import ai.evacortex.attopulse.core.metrics.EllipticitySpectrum;
import ai.evacortex.attopulse.core.metrics.PhaseSpectrum;
import ai.evacortex.attopulse.core.pulse.PulseProfile;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.SpectralAmplitude;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes analysis results as whitespace-separated text tables and the run summary as JSON.
 *
 * <p>Each table starts with {@code #} header lines describing the driving field, the harmonic band
 * and the fingerprint of the analysed input, followed by one row per sample with values formatted
 * {@code %.12e}.</p>
 */
public final class AnalysisExporter {

    private static final String VALUE_FORMAT = "%.12e";

    private final String inputFingerprint;
    private final ObjectMapper mapper;

    public AnalysisExporter(String inputFingerprint) {
        this.inputFingerprint = Objects.requireNonNull(inputFingerprint, "inputFingerprint must not be null");
        this.mapper = new ObjectMapper();
    }

    public void writeSpectrum(Path out, SpectralAmplitude amplitude) {
        double[] orders = amplitude.harmonicOrders();
        double[] sx = amplitude.logSpectrumX();
        double[] sy = amplitude.logSpectrumY();
        double[] s = amplitude.logSpectrumTotal();
        DrivingField field = amplitude.grid().field();
        writeTable(out, "HHG spectrum", field, amplitude.grid().qStart(), amplitude.grid().qEnd(),
                "order Sx Sy S", orders.length, i -> new double[]{orders[i], sx[i], sy[i], s[i]});
    }

    public void writePhase(Path out, DrivingField field, PhaseSpectrum phase) {
        double[] q = phase.harmonicOrders();
        writeTable(out, "HHG phase (rad)", field, q[0], q[q.length - 1],
                "order phiX phiY phiTot", q.length,
                i -> new double[]{q[i], phase.phaseX()[i], phase.phaseY()[i], phase.phaseTotal()[i]});
    }

    public void writeEllipticity(Path out, DrivingField field, EllipticitySpectrum ellipticity) {
        double[] q = ellipticity.harmonicOrders();
        writeTable(out, "HHG ellipticity", field, q[0], q[q.length - 1],
                "order eps", q.length, i -> new double[]{q[i], ellipticity.ellipticity()[i]});
    }

    public void writePulse(Path out, PulseProfile profile) {
        double[] toc = profile.timeOpticalCycles();
        writeTable(out, "Attosecond pulse", profile.field(), profile.qStart(), profile.qEnd(),
                "t_oc Ix Iy I", toc.length,
                i -> new double[]{toc[i], profile.intensityX()[i], profile.intensityY()[i], profile.intensity()[i]});
    }

    /**
     * Flattens the map time-major: for every time sample, one row per frequency bin.
     */
    public void writeTimeFrequency(Path out, TimeFrequencyMap map) {
        int nw = map.frequencyBins();
        double[] q = map.harmonicOrders();
        writeTable(out, "Time-frequency map (g = " + map.gFactor() + ")", map.field(), q[0], q[q.length - 1],
                "t omega logX logY logTot", map.timeSamples() * nw,
                r -> {
                    int j = r / nw;
                    int k = r % nw;
                    return new double[]{map.t()[j], map.omega()[k], map.logX()[j][k], map.logY()[j][k],
                            map.logTotal()[j][k]};
                });
    }

    public void writeSummary(Path out, AnalysisSummary summary) {
        try {
            createParent(out);
            try (OutputStream os = Files.newOutputStream(out, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(os, summary);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write summary " + out, e);
        }
    }

    public AnalysisSummary readSummary(Path in) {
        try (InputStream is = Files.newInputStream(in)) {
            return mapper.readValue(is, AnalysisSummary.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read summary " + in, e);
        }
    }

    @FunctionalInterface
    private interface RowSource {
        double[] row(int index);
    }

    private void writeTable(Path out, String title, DrivingField field, double qStart, double qEnd,
                            String columns, int rows, RowSource source) {
        try {
            createParent(out);
            try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
                w.write("# " + title);
                w.newLine();
                w.write(String.format(Locale.ROOT, "# lambda0_nm = %s", field.lambdaNm()));
                w.newLine();
                w.write(String.format(Locale.ROOT, "# omega0_au = " + VALUE_FORMAT, field.omega0()));
                w.newLine();
                w.write(String.format(Locale.ROOT, "# period_au = " + VALUE_FORMAT, field.period()));
                w.newLine();
                w.write(String.format(Locale.ROOT, "# band = [%s, %s]", qStart, qEnd));
                w.newLine();
                w.write("# input_xxh64 = " + inputFingerprint);
                w.newLine();
                w.write("# columns: " + columns);
                w.newLine();

                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < rows; i++) {
                    sb.setLength(0);
                    double[] values = source.row(i);
                    for (int c = 0; c < values.length; c++) {
                        if (c > 0) sb.append(' ');
                        sb.append(String.format(Locale.ROOT, VALUE_FORMAT, values[c]));
                    }
                    w.write(sb.toString());
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export " + title + " to " + out, e);
        }
    }

    private static void createParent(Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
