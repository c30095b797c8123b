/**
 * The dispatch engine.
 *
 * <p>{@link com.phillippitts.voicedispatch.service.dispatch.Dispatcher} owns the poll loop,
 * {@link com.phillippitts.voicedispatch.service.dispatch.KeyPhraseDetector} finds the wake
 * phrase and {@link com.phillippitts.voicedispatch.service.dispatch.DispatcherLifecycle}
 * runs the loop inside the Spring context.
 *
 * <p>Key-phrase matching is literal: tokens are reduced to lowercase letters and compared for
 * exact equality. There is no fuzzy matching or language understanding at this level.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.service.dispatch;
