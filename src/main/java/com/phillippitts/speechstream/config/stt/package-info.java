/**
 * Recognition engine configuration.
 *
 * <ul>
 *   <li>{@link com.phillippitts.speechstream.config.stt.VoskConfig} - {@code stt.vosk.*}</li>
 *   <li>{@code ModelValidationService} - startup check of the model directory
 *       ({@code stt.validation.enabled}, default true)</li>
 * </ul>
 */
package com.phillippitts.speechstream.config.stt;
