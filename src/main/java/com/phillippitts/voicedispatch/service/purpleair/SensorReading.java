package com.phillippitts.voicedispatch.service.purpleair;

/**
 * The values read from the first result of a sensor report. Absent values are null.
 *
 * @param location     where the sensor is installed ("inside"/"outside"), or "" if unknown
 * @param pm25         PM2.5 concentration in µg/m³
 * @param humidity     relative humidity as reported
 * @param temperatureF temperature in Fahrenheit as reported
 */
public record SensorReading(String location, Double pm25, String humidity, String temperatureF) {

    public static final SensorReading EMPTY = new SensorReading("", null, null, null);

    public SensorReading {
        location = location == null ? "" : location.trim();
    }
}
