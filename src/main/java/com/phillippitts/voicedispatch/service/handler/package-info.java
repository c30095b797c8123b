/**
 * Service evaluation contracts: {@link com.phillippitts.voicedispatch.service.handler.Service}
 * produces a {@link com.phillippitts.voicedispatch.service.handler.Handler} that, when
 * invoked, yields a {@link com.phillippitts.voicedispatch.service.handler.Result}.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.service.handler;
