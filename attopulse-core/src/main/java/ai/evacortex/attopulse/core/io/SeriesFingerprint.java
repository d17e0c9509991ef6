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
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * xxHash64 over the raw samples of a {@link TimeSeries}, row by row as {@code (t, jx, jy)}.
 */
public final class SeriesFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private SeriesFingerprint() {}

    public static long compute(TimeSeries series) {
        double[] t = series.t();
        double[] jx = series.jx();
        double[] jy = series.jy();
        ByteBuffer buffer = ByteBuffer.allocate(t.length * 3 * Double.BYTES);
        for (int i = 0; i < t.length; i++) {
            buffer.putDouble(t[i]);
            buffer.putDouble(jx[i]);
            buffer.putDouble(jy[i]);
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static String hex(TimeSeries series) {
        return HexFormat.of().toHexDigits(compute(series));
    }
}
