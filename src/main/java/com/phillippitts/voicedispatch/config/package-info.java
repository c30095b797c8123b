/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voicedispatch.config.DispatcherConfig} - component registry,
 *       configured components, dispatcher and its lifecycle</li>
 *   <li>{@link com.phillippitts.voicedispatch.config.ThreadPoolConfig} - executor running the
 *       dispatch loop</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.config;
