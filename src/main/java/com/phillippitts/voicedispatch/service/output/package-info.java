/**
 * Output components receiving the dispatcher's responses.
 */
package com.phillippitts.voicedispatch.service.output;
