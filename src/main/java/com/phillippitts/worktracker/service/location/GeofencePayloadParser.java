package com.phillippitts.worktracker.service.location;

import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.TransitionType;
import com.phillippitts.worktracker.exception.InvalidTransitionException;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Validates raw geofence payloads from the device into {@link LocationTransition}s.
 *
 * <p>Accepts the flat form used by the HTTP API as well as the shape region-monitoring
 * libraries emit:
 * <ul>
 *   <li><b>Flat:</b> {@code {"siteId": "...", "eventType": "enter", "timestamp": "...", "latitude": ..,
 *       "longitude": .., "accuracy": ..}}</li>
 *   <li><b>Region:</b> {@code {"region": {"identifier": "..."}, "eventType": 1,
 *       "location": {"timestamp": 1700000000000, "coords": {"latitude": .., "longitude": .., "accuracy": ..}}}}</li>
 * </ul>
 *
 * <p>Event types are {@code enter}/{@code exit} (case-insensitive) or the numeric codes 1 and 2.
 * Timestamps are ISO-8601 instants or epoch milliseconds; when absent the receive time is used.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class GeofencePayloadParser {

    /** Payloads larger than this are rejected outright. */
    static final int MAX_PAYLOAD_SIZE = 16_384;

    private GeofencePayloadParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one payload.
     *
     * @param json       raw request body
     * @param receivedAt fallback timestamp
     * @return validated transition
     * @throws InvalidTransitionException if the payload is malformed or incomplete
     */
    public static LocationTransition parse(String json, Instant receivedAt) {
        if (json == null || json.isBlank()) {
            throw new InvalidTransitionException("empty payload");
        }
        if (json.length() > MAX_PAYLOAD_SIZE) {
            throw new InvalidTransitionException("payload exceeds " + MAX_PAYLOAD_SIZE + " characters");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new InvalidTransitionException("not a JSON object", e);
        }

        String siteId = extractSiteId(obj);
        TransitionType type = extractType(obj);

        JSONObject location = obj.optJSONObject("location");
        JSONObject coords = location != null ? location.optJSONObject("coords") : null;
        JSONObject positionSource = coords != null ? coords : obj;

        Instant timestamp = extractTimestamp(obj, location, receivedAt);
        Double latitude = optFinite(positionSource, "latitude");
        Double longitude = optFinite(positionSource, "longitude");
        Double accuracy = optFinite(positionSource, "accuracy");

        if ((latitude == null) != (longitude == null)) {
            throw new InvalidTransitionException("latitude and longitude must be supplied together");
        }
        if (latitude != null && (latitude < -90.0 || latitude > 90.0)) {
            throw new InvalidTransitionException("latitude out of range: " + latitude);
        }
        if (longitude != null && (longitude < -180.0 || longitude > 180.0)) {
            throw new InvalidTransitionException("longitude out of range: " + longitude);
        }

        return new LocationTransition(siteId, type, timestamp, latitude, longitude, accuracy);
    }

    private static String extractSiteId(JSONObject obj) {
        String siteId = obj.optString("siteId", null);
        if (siteId == null) {
            siteId = obj.optString("identifier", null);
        }
        if (siteId == null) {
            JSONObject region = obj.optJSONObject("region");
            if (region != null) {
                siteId = region.optString("identifier", null);
            }
        }
        if (siteId == null || siteId.isBlank()) {
            throw new InvalidTransitionException("missing site identifier");
        }
        return siteId.trim();
    }

    private static TransitionType extractType(JSONObject obj) {
        Object raw = obj.has("eventType") ? obj.get("eventType") : obj.opt("event");
        if (raw == null || JSONObject.NULL.equals(raw)) {
            throw new InvalidTransitionException("missing event type");
        }
        if (raw instanceof Number n) {
            return switch (n.intValue()) {
                case 1 -> TransitionType.ENTER;
                case 2 -> TransitionType.EXIT;
                default -> throw new InvalidTransitionException("unknown event type code: " + n);
            };
        }
        String name = raw.toString().trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "enter", "1" -> TransitionType.ENTER;
            case "exit", "2" -> TransitionType.EXIT;
            default -> throw new InvalidTransitionException("unknown event type: " + raw);
        };
    }

    private static Instant extractTimestamp(JSONObject obj, JSONObject location, Instant receivedAt) {
        Object raw = obj.opt("timestamp");
        if (raw == null && location != null) {
            raw = location.opt("timestamp");
        }
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return receivedAt;
        }
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        try {
            return Instant.parse(raw.toString().trim());
        } catch (DateTimeParseException e) {
            throw new InvalidTransitionException("unparseable timestamp: " + raw, e);
        }
    }

    private static Double optFinite(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        double value = obj.optDouble(key, Double.NaN);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidTransitionException(key + " is not a number");
        }
        return value;
    }
}
