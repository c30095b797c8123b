/**
 * Service pressing key chords for spoken editing and window-management phrases.
 */
package com.phillippitts.voicedispatch.service.keyboard;
