/**
 * Domain values shared by every layer: {@link com.phillippitts.voicedispatch.domain.Token}
 * for utterance content and {@link com.phillippitts.voicedispatch.domain.Status} for the
 * component lifecycle.
 *
 * <p>Types in this package are immutable and free of Spring dependencies.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.domain;
