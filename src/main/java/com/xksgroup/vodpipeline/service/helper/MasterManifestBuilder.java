package com.xksgroup.vodpipeline.service.helper;

import com.xksgroup.vodpipeline.model.Rendition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the HLS master playlist referencing each variant playlist relative to the master.
 */
public final class MasterManifestBuilder {

    public static final String VARIANT_PLAYLIST_NAME = "playlist.m3u8";

    // Highest bandwidth first, taller rendition first on ties
    public static final Comparator<Rendition> MANIFEST_ORDER = Comparator
            .comparingInt(Rendition::getBandwidthEstimate).reversed()
            .thenComparing(Comparator.comparingInt(Rendition::getHeight).reversed());

    private MasterManifestBuilder() {
    }

    public static List<Rendition> order(List<Rendition> renditions) {
        List<Rendition> sorted = new ArrayList<>(renditions);
        sorted.sort(MANIFEST_ORDER);
        return sorted;
    }

    public static String build(List<Rendition> renditions) {
        if (renditions.isEmpty()) {
            throw new IllegalArgumentException("No renditions were produced. Cannot create master playlist.");
        }

        StringBuilder content = new StringBuilder();
        content.append("#EXTM3U\n");
        content.append("#EXT-X-VERSION:3\n\n");

        for (Rendition rendition : order(renditions)) {
            content.append("#EXT-X-STREAM-INF:");
            content.append("BANDWIDTH=").append(rendition.getBandwidthEstimate());
            if (rendition.getWidth() > 0 && rendition.getHeight() > 0) {
                content.append(",RESOLUTION=").append(rendition.getWidth()).append('x').append(rendition.getHeight());
            }
            content.append(",NAME=\"").append(rendition.getLabel()).append("\"\n");
            content.append(rendition.getLabel()).append('/').append(VARIANT_PLAYLIST_NAME).append("\n\n");
        }
        return content.toString();
    }
}
