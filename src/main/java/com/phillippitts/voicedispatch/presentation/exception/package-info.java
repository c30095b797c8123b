/**
 * Translation of exceptions into JSON error responses.
 */
package com.phillippitts.voicedispatch.presentation.exception;
