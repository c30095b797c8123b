/**
 * Domain exception hierarchy rooted at
 * {@link com.phillippitts.voicedispatch.exception.VoiceDispatchException}.
 *
 * <p>All exceptions are unchecked. Only
 * {@link com.phillippitts.voicedispatch.exception.ComponentStartupException} is allowed to
 * escape the dispatcher; everything raised while producing a response is logged and absorbed.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.exception;
