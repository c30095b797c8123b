/**
 * Service answering air quality, humidity and temperature questions from a PurpleAir sensor.
 */
package com.phillippitts.voicedispatch.service.purpleair;
