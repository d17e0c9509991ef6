/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.io;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.exceptions.InputValidationException;
import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loader for "total_current" simulation output: whitespace-separated columns
 * {@code iteration time jx jy [jz ...]}. Lines starting with {@code #} and blank lines are skipped.
 * The first sample is subtracted from {@code jx} and {@code jy}.
 */
public final class TotalCurrentReader {

    private static final Logger log = LoggerFactory.getLogger(TotalCurrentReader.class);

    public static final String EXPECTED_NAME = "total_current";
    private static final int MIN_COLUMNS = 4;
    private static final int TIME_COLUMN = 1;
    private static final int JX_COLUMN = 2;
    private static final int JY_COLUMN = 3;

    private TotalCurrentReader() {}

    public static TimeSeries read(Path path) {
        return read(path, 1);
    }

    /**
     * Reads every {@code stride}-th row starting from the first data row.
     */
    public static TimeSeries read(Path path, int stride) {
        Objects.requireNonNull(path, "path must not be null");
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputValidationException("failed to read " + path, e);
        }
        try {
            return parse(lines, stride);
        } catch (InputValidationException e) {
            log.debug("Rejected {}: {}", path, e.getMessage());
            throw e;
        }
    }

    /**
     * Rejects files whose name does not contain {@value #EXPECTED_NAME} (case-insensitive).
     */
    public static void requireTotalCurrentName(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path name = path.getFileName();
        if (name == null || !name.toString().toLowerCase(Locale.ROOT).contains(EXPECTED_NAME)) {
            throw new InputValidationException("expected a '" + EXPECTED_NAME + "' file, got " + path);
        }
    }

    public static TimeSeries parse(List<String> lines, int stride) {
        Objects.requireNonNull(lines, "lines must not be null");
        if (stride < 1) {
            throw new NumericPreconditionException("reading stride must be >= 1, got " + stride);
        }

        int rows = 0;
        for (String line : lines) {
            if (isData(line)) rows++;
        }
        if (rows == 0) {
            throw new InputValidationException("the file is empty");
        }

        double[] t = new double[rows];
        double[] jx = new double[rows];
        double[] jy = new double[rows];

        int k = 0;
        for (int n = 0; n < lines.size(); n++) {
            String line = lines.get(n);
            if (!isData(line)) continue;

            String[] cols = line.trim().split("\\s+");
            if (cols.length < MIN_COLUMNS) {
                throw new InputValidationException("line " + (n + 1) + ": expected at least " + MIN_COLUMNS
                        + " columns, got " + cols.length);
            }
            try {
                t[k] = Double.parseDouble(cols[TIME_COLUMN]);
                jx[k] = Double.parseDouble(cols[JX_COLUMN]);
                jy[k] = Double.parseDouble(cols[JY_COLUMN]);
            } catch (NumberFormatException e) {
                throw new InputValidationException("line " + (n + 1) + ": malformed number", e);
            }
            k++;
        }

        return new TimeSeries(t, jx, jy).downsample(stride).withOffsetRemoved();
    }

    private static boolean isData(String line) {
        String s = line.strip();
        return !s.isEmpty() && !s.startsWith("#");
    }
}
