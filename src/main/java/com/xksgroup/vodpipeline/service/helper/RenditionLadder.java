package com.xksgroup.vodpipeline.service.helper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Standard HLS resolution ladder. Never upscales: a source only gets rungs at or below its height.
 */
public final class RenditionLadder {

    public static final List<Integer> STANDARD_HEIGHTS = List.of(2160, 1440, 1080, 720, 480, 360, 240, 144);

    private static final Map<Integer, Integer> BANDWIDTH_BY_HEIGHT = Map.of(
            2160, 8_000_000,
            1440, 6_000_000,
            1080, 5_000_000,
            720, 2_800_000,
            480, 1_400_000,
            360, 800_000,
            240, 500_000,
            144, 300_000
    );

    private static final int CUSTOM_BANDWIDTH_PER_LINE = 2500;

    private RenditionLadder() {
    }

    /**
     * Heights to produce for a source, highest first. A source below the smallest rung gets a
     * single rendition at its own height.
     */
    public static List<Integer> select(int sourceHeight) {
        for (int i = 0; i < STANDARD_HEIGHTS.size(); i++) {
            if (STANDARD_HEIGHTS.get(i) <= sourceHeight) {
                return new ArrayList<>(STANDARD_HEIGHTS.subList(i, STANDARD_HEIGHTS.size()));
            }
        }
        return new ArrayList<>(List.of(sourceHeight));
    }

    public static int bandwidthFor(int height) {
        Integer bandwidth = BANDWIDTH_BY_HEIGHT.get(height);
        return bandwidth != null ? bandwidth : height * CUSTOM_BANDWIDTH_PER_LINE;
    }

    /**
     * AAC bitrate in kbps; higher resolutions get better audio.
     */
    public static int audioBitrateFor(int height) {
        if (height >= 1080) {
            return 192;
        }
        if (height >= 720) {
            return 160;
        }
        if (height >= 480) {
            return 128;
        }
        return 96;
    }

    /**
     * Output width for a target height, keeping the source aspect ratio and rounding to an even
     * number as {@code scale=-2:h} does.
     */
    public static int widthFor(int height, int sourceWidth, int sourceHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            return Math.max(2, (int) Math.round(height * 16.0 / 9.0) / 2 * 2);
        }
        int width = (int) Math.round((double) sourceWidth * height / sourceHeight);
        width = width / 2 * 2;
        return Math.max(2, width);
    }

    public static String labelFor(int height) {
        return height + "p";
    }
}
