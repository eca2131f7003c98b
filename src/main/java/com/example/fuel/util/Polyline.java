package com.example.fuel.util;

import com.example.fuel.model.Waypoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for Google's encoded polyline format (five decimal places of precision).
 */
public final class Polyline {

    private Polyline() {
    }

    public static List<Waypoint> decode(String encoded) {
        List<Waypoint> path = new ArrayList<>();
        if (encoded == null) {
            return path;
        }
        int[] index = {0};
        int lat = 0;
        int lng = 0;
        int len = encoded.length();

        while (index[0] < len) {
            lat += nextDelta(encoded, index);
            if (index[0] >= len) {
                throw new IllegalArgumentException("Truncated polyline at offset " + index[0]);
            }
            lng += nextDelta(encoded, index);
            path.add(new Waypoint(lat / 1E5, lng / 1E5));
        }
        return path;
    }

    private static int nextDelta(String encoded, int[] index) {
        int b;
        int shift = 0;
        int result = 0;
        do {
            if (index[0] >= encoded.length()) {
                throw new IllegalArgumentException("Truncated polyline at offset " + index[0]);
            }
            b = encoded.charAt(index[0]++) - 63;
            result |= (b & 0x1f) << shift;
            shift += 5;
        } while (b >= 0x20);
        return (result & 1) != 0 ? ~(result >> 1) : (result >> 1);
    }
}
