package org.Aayush.roadnet.acquisition;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Assigns a speed (km/h) to every raw edge.
 *
 * <p>Resolution order per edge:</p>
 * <ol>
 * <li>Parsed {@code maxspeed} tag.</li>
 * <li>Mean parsed speed of edges sharing the same {@code highway} class.</li>
 * <li>Configured default speed.</li>
 * </ol>
 */
public final class EdgeSpeedImputer {
    private static final double KPH_PER_MPH = 1.609344d;

    private final double defaultSpeedKph;

    public EdgeSpeedImputer(double defaultSpeedKph) {
        if (!Double.isFinite(defaultSpeedKph) || defaultSpeedKph <= 0.0d) {
            throw new IllegalArgumentException("defaultSpeedKph must be finite and > 0, got " + defaultSpeedKph);
        }
        this.defaultSpeedKph = defaultSpeedKph;
    }

    /**
     * Returns one speed per edge, index-aligned with {@code edges}.
     */
    public double[] imputeSpeeds(List<RawRoadGraph.RawEdge> edges) {
        Objects.requireNonNull(edges, "edges");
        int size = edges.size();
        double[] speeds = new double[size];
        boolean[] known = new boolean[size];

        Object2DoubleOpenHashMap<String> speedSumByClass = new Object2DoubleOpenHashMap<>();
        Object2IntOpenHashMap<String> countByClass = new Object2IntOpenHashMap<>();
        for (int i = 0; i < size; i++) {
            RawRoadGraph.RawEdge edge = edges.get(i);
            OptionalDouble parsed = parseMaxSpeed(edge.maxSpeed());
            if (parsed.isPresent()) {
                speeds[i] = parsed.getAsDouble();
                known[i] = true;
                String roadClass = roadClass(edge.highway());
                speedSumByClass.addTo(roadClass, speeds[i]);
                countByClass.addTo(roadClass, 1);
            }
        }

        for (int i = 0; i < size; i++) {
            if (known[i]) {
                continue;
            }
            String roadClass = roadClass(edges.get(i).highway());
            int count = countByClass.getInt(roadClass);
            speeds[i] = count > 0 ? speedSumByClass.getDouble(roadClass) / count : defaultSpeedKph;
        }
        return speeds;
    }

    /**
     * Parses an OSM-style {@code maxspeed} value.
     *
     * <p>Accepts plain km/h numbers, {@code "NN mph"}, and {@code ;}-separated lists (averaged).
     * Symbolic values such as {@code "none"} or {@code "signals"} yield empty.</p>
     */
    public static OptionalDouble parseMaxSpeed(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        double sum = 0.0d;
        int count = 0;
        for (String part : raw.split(";")) {
            OptionalDouble value = parseSingleSpeed(part);
            if (value.isPresent()) {
                sum += value.getAsDouble();
                count++;
            }
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }

    private static OptionalDouble parseSingleSpeed(String part) {
        String value = part.trim().toLowerCase(Locale.ROOT);
        double multiplier = 1.0d;
        if (value.endsWith("mph")) {
            multiplier = KPH_PER_MPH;
            value = value.substring(0, value.length() - 3).trim();
        } else if (value.endsWith("km/h")) {
            value = value.substring(0, value.length() - 4).trim();
        } else if (value.endsWith("kmh")) {
            value = value.substring(0, value.length() - 3).trim();
        }
        try {
            double speed = Double.parseDouble(value) * multiplier;
            if (!Double.isFinite(speed) || speed <= 0.0d) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(speed);
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    private static String roadClass(String highway) {
        return highway == null ? "" : highway;
    }
}
