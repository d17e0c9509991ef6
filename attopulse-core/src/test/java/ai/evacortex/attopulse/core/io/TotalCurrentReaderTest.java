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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TotalCurrentReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, List.of(lines));
        return file;
    }

    @Test
    void testReadsColumnsAndRemovesOffset() throws IOException {
        Path file = write("total_current.dat",
                "# iter  t  jx  jy  jz",
                "",
                "0  0.0  1.5  -2.0  9.0",
                "1  0.1  2.5  -1.0  9.0",
                "   2  0.2  4.5   0.0  9.0  ",
                "# trailing comment",
                "3  0.3  1.5  -2.0  9.0",
                "4  0.4  0.5  -3.0  9.0");

        TimeSeries series = TotalCurrentReader.read(file);

        assertEquals(5, series.size());
        assertArrayEquals(new double[]{0.0, 0.1, 0.2, 0.3, 0.4}, series.t(), 0.0);
        assertArrayEquals(new double[]{0.0, 1.0, 3.0, 0.0, -1.0}, series.jx(), 1e-15);
        assertArrayEquals(new double[]{0.0, 1.0, 2.0, 0.0, -1.0}, series.jy(), 1e-15);
    }

    @Test
    void testStrideKeepsEveryNthRow() throws IOException {
        Path file = write("total_current.dat",
                "0 0.0 1 1", "1 0.1 2 2", "2 0.2 3 3", "3 0.3 4 4", "4 0.4 5 5");
        TimeSeries series = TotalCurrentReader.read(file, 2);
        assertArrayEquals(new double[]{0.0, 0.2, 0.4}, series.t(), 0.0);
        assertArrayEquals(new double[]{0.0, 2.0, 4.0}, series.jx(), 1e-15);
        assertThrows(NumericPreconditionException.class, () -> TotalCurrentReader.read(file, 0));
    }

    @Test
    void testStrideMatchesSeriesDownsampling() throws IOException {
        Path file = write("total_current.dat",
                "0 0.0 3 -1", "1 0.1 5 2", "2 0.2 7 4", "3 0.3 2 6", "4 0.4 8 1", "5 0.5 4 0", "6 0.6 6 9");
        TimeSeries raw = new TimeSeries(
                new double[]{0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6},
                new double[]{3, 5, 7, 2, 8, 4, 6},
                new double[]{-1, 2, 4, 6, 1, 0, 9});
        TimeSeries expected = raw.downsample(3).withOffsetRemoved();

        TimeSeries series = TotalCurrentReader.read(file, 3);

        assertArrayEquals(expected.t(), series.t(), 0.0);
        assertArrayEquals(expected.jx(), series.jx(), 0.0);
        assertArrayEquals(expected.jy(), series.jy(), 0.0);
        assertArrayEquals(new double[]{0.0, -1.0, 3.0}, series.jx(), 0.0);
    }

    @Test
    void testMalformedRowBetweenStridesIsRejected() throws IOException {
        Path file = write("total_current.dat", "0 0.0 1 1", "1 0.1 oops 2", "2 0.2 3 3");
        assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(file, 2));
    }

    @Test
    void testRejectsEmptyFile() throws IOException {
        Path file = write("total_current.dat", "# only a header", "");
        InputValidationException e = assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(file));
        assertTrue(e.getMessage().startsWith("Invalid input: "));
    }

    @Test
    void testRejectsConstantCurrent() throws IOException {
        Path file = write("total_current.dat", "0 0.0 7 7", "1 0.1 7 7", "2 0.2 7 7");
        assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(file));
    }

    @Test
    void testRejectsMalformedRows() throws IOException {
        Path shortRow = write("total_current_a.dat", "0 0.0 1 1", "1 0.1 2");
        assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(shortRow));

        Path garbage = write("total_current_b.dat", "0 0.0 1 1", "1 0.1 x 2");
        InputValidationException e = assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(garbage));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testRejectsSingleRow() throws IOException {
        Path file = write("total_current.dat", "0 0.0 1 1");
        assertThrows(InputValidationException.class, () -> TotalCurrentReader.read(file));
    }

    @Test
    void testWrapsMissingFile() {
        InputValidationException e = assertThrows(InputValidationException.class,
                () -> TotalCurrentReader.read(tempDir.resolve("total_current_missing.dat")));
        assertInstanceOf(NoSuchFileException.class, e.getCause());
    }

    @Test
    void testFileNameHeuristic() {
        assertDoesNotThrow(() -> TotalCurrentReader.requireTotalCurrentName(Path.of("run", "Total_Current_01.txt")));
        assertThrows(InputValidationException.class,
                () -> TotalCurrentReader.requireTotalCurrentName(Path.of("total_current", "spectrum.dat")));
    }
}
