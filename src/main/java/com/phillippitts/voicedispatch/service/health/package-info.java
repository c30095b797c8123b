/**
 * Actuator health indicators.
 */
package com.phillippitts.voicedispatch.service.health;
