/**
 * REST controllers.
 */
package com.phillippitts.voicedispatch.presentation.controller;
