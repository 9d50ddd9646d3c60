package org.Aayush.roadnet.acquisition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.Aayush.roadnet.geo.GeoDistance;
import org.Aayush.roadnet.geo.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link MapDataProvider} backed by an Overpass API endpoint (OpenStreetMap data).
 *
 * <p>Fetches drivable {@code highway} ways around the query point and turns consecutive
 * way nodes into directed edges. One-way tagging is honoured; everything else becomes two
 * opposing edges.</p>
 */
public class OverpassMapDataProvider implements MapDataProvider {
    public static final String DEFAULT_ENDPOINT = "https://overpass-api.de/api/interpreter";
    private static final long DEFAULT_TIMEOUT_MS = 25_000;

    // Road classes that are not part of the drivable network.
    private static final String EXCLUDED_HIGHWAY_REGEX =
            "abandoned|bridleway|bus_guideway|construction|corridor|cycleway|elevator|escalator|footway|"
                    + "path|pedestrian|planned|platform|proposed|raceway|service|steps|track";

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String endpoint;
    private final OkHttpClient downloader;
    private final ObjectMapper objectMapper;

    public OverpassMapDataProvider() {
        this(DEFAULT_ENDPOINT);
    }

    public OverpassMapDataProvider(String endpoint) {
        this(endpoint, new OkHttpClient.Builder()
                .connectTimeout(DEFAULT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .readTimeout(DEFAULT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .build());
    }

    public OverpassMapDataProvider(String endpoint, OkHttpClient downloader) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public RawRoadGraph fetchDrivableNetwork(GeoPoint center, double radiusMeters) {
        String query = buildQuery(center, radiusMeters);
        Request request = new Request.Builder()
                .url(endpoint)
                .post(new FormBody.Builder().add("data", query).build())
                .build();

        logger.debug("Overpass query: {}", query);
        try (Response rsp = downloader.newCall(request).execute()) {
            if (!rsp.isSuccessful()) {
                throw new MapDataProviderException(
                        MapDataProviderException.REASON_UNAVAILABLE,
                        "Overpass returned HTTP " + rsp.code() + " for " + endpoint
                );
            }
            ResponseBody body = rsp.body();
            if (body == null) {
                throw new MapDataProviderException(MapDataProviderException.REASON_BAD_RESPONSE, "empty Overpass response");
            }
            JsonNode json = objectMapper.readTree(body.byteStream());
            return parse(json);
        } catch (IOException ex) {
            throw new MapDataProviderException(
                    MapDataProviderException.REASON_UNAVAILABLE,
                    "Overpass request failed: " + ex.getMessage(),
                    ex
            );
        }
    }

    /**
     * Overpass QL for drivable ways within {@code radiusMeters} of {@code center},
     * recursing down to their nodes.
     */
    static String buildQuery(GeoPoint center, double radiusMeters) {
        return String.format(Locale.ROOT,
                "[out:json][timeout:25];"
                        + "(way[\"highway\"][\"area\"!~\"yes\"][\"highway\"!~\"%s\"]"
                        + "[\"motor_vehicle\"!~\"no\"][\"motorcar\"!~\"no\"][\"access\"!~\"private\"]"
                        + "(around:%.1f,%.7f,%.7f););(._;>;);out body;",
                EXCLUDED_HIGHWAY_REGEX, radiusMeters, center.getLatitude(), center.getLongitude());
    }

    /**
     * Converts an Overpass JSON document into a raw graph.
     */
    RawRoadGraph parse(JsonNode json) {
        JsonNode elements = json.get("elements");
        if (elements == null || !elements.isArray()) {
            throw new MapDataProviderException(MapDataProviderException.REASON_BAD_RESPONSE, "missing 'elements' array");
        }

        Map<String, RawRoadGraph.RawNode> nodesById = new HashMap<>();
        List<JsonNode> ways = new ArrayList<>();
        for (JsonNode element : elements) {
            String type = element.path("type").asText();
            if ("node".equals(type)) {
                String id = element.path("id").asText();
                nodesById.put(id, new RawRoadGraph.RawNode(
                        id,
                        element.path("lat").asDouble(),
                        element.path("lon").asDouble()
                ));
            } else if ("way".equals(type)) {
                ways.add(element);
            }
        }

        Set<String> usedNodeIds = new LinkedHashSet<>();
        List<RawRoadGraph.RawEdge> edges = new ArrayList<>();
        for (JsonNode way : ways) {
            JsonNode tags = way.path("tags");
            String highway = textOrNull(tags, "highway");
            String maxSpeed = textOrNull(tags, "maxspeed");
            Direction direction = Direction.of(tags, highway);

            JsonNode wayNodes = way.path("nodes");
            for (int i = 0; i + 1 < wayNodes.size(); i++) {
                RawRoadGraph.RawNode a = nodesById.get(wayNodes.get(i).asText());
                RawRoadGraph.RawNode b = nodesById.get(wayNodes.get(i + 1).asText());
                if (a == null || b == null || a.id().equals(b.id())) {
                    continue;
                }
                double length = GeoDistance.haversineMeters(a.latitude(), a.longitude(), b.latitude(), b.longitude());
                usedNodeIds.add(a.id());
                usedNodeIds.add(b.id());
                if (direction != Direction.BACKWARD) {
                    edges.add(new RawRoadGraph.RawEdge(a.id(), b.id(), length, highway, maxSpeed));
                }
                if (direction != Direction.FORWARD) {
                    edges.add(new RawRoadGraph.RawEdge(b.id(), a.id(), length, highway, maxSpeed));
                }
            }
        }

        List<RawRoadGraph.RawNode> nodes = new ArrayList<>(usedNodeIds.size());
        for (String id : usedNodeIds) {
            nodes.add(nodesById.get(id));
        }
        return new RawRoadGraph(nodes, edges);
    }

    private static String textOrNull(JsonNode tags, String field) {
        JsonNode value = tags.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private enum Direction {
        FORWARD,
        BACKWARD,
        BOTH;

        static Direction of(JsonNode tags, String highway) {
            String oneway = textOrNull(tags, "oneway");
            if (oneway != null) {
                switch (oneway.toLowerCase(Locale.ROOT)) {
                    case "yes", "true", "1":
                        return FORWARD;
                    case "-1", "reverse":
                        return BACKWARD;
                    case "no", "false", "0":
                        return BOTH;
                    default:
                        break;
                }
            }
            if ("roundabout".equals(textOrNull(tags, "junction")) || "motorway".equals(highway)) {
                return FORWARD;
            }
            return BOTH;
        }
    }
}
