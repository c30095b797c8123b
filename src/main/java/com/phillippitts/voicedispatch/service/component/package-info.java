/**
 * Capability interfaces for pluggable components and their shared lifecycle.
 *
 * <p>{@link com.phillippitts.voicedispatch.service.component.Component} is the root;
 * {@link com.phillippitts.voicedispatch.service.component.Input} and
 * {@link com.phillippitts.voicedispatch.service.component.Output} add the I/O operations and
 * {@link com.phillippitts.voicedispatch.service.handler.Service} adds evaluation.
 * Concrete components usually extend
 * {@link com.phillippitts.voicedispatch.service.component.AbstractComponent}.
 *
 * @since 1.0
 */
package com.phillippitts.voicedispatch.service.component;
