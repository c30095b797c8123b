/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the input queue and the status notifier; the
 * presentation layer depends on services but not vice versa.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.presentation;
