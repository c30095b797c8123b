/**
 * Input components: text submitted over HTTP and lines typed on the console.
 */
package com.phillippitts.voicedispatch.service.input;
