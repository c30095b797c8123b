package com.phillippitts.voicedispatch.service.purpleair;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses the sensor JSON document: {@code {"results": [{"PM2_5Value": "12.3", ...}, ...]}}.
 * Only the first entry of {@code results} is used; it describes the requested sensor.
 *
 * <p>Thread-safe: stateless.
 */
final class PurpleAirJsonParser {

    private static final Logger LOG = LogManager.getLogger(PurpleAirJsonParser.class);

    static final String FIELD_LOCATION = "DEVICE_LOCATIONTYPE";
    static final String FIELD_PM25 = "PM2_5Value";
    static final String FIELD_HUMIDITY = "humidity";
    static final String FIELD_TEMPERATURE = "temp_f";

    private PurpleAirJsonParser() {
    }

    /**
     * @param json raw document
     * @return the reading, {@link SensorReading#EMPTY} if the document has no results
     * @throws JSONException if the document is not valid JSON
     * @throws NumberFormatException if the PM2.5 value is not a number
     */
    static SensorReading parse(String json) {
        JSONObject root = new JSONObject(json);
        JSONArray results = root.optJSONArray("results");
        if (results == null || results.isEmpty()) {
            LOG.debug("Sensor document has no results");
            return SensorReading.EMPTY;
        }
        JSONObject first = results.getJSONObject(0);
        LOG.debug("Got: {}", first);
        String pm25 = optValue(first, FIELD_PM25);
        return new SensorReading(
                first.optString(FIELD_LOCATION, ""),
                pm25 == null ? null : Double.valueOf(pm25),
                optValue(first, FIELD_HUMIDITY),
                optValue(first, FIELD_TEMPERATURE));
    }

    // Values arrive either as strings or as numbers
    private static String optValue(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        String value = String.valueOf(obj.get(key)).trim();
        return value.isEmpty() ? null : value;
    }
}
