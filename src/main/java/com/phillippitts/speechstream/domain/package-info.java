/**
 * Domain value types shared by the recognition services and the HTTP layer.
 *
 * <p>{@link com.phillippitts.speechstream.domain.RecognitionResult} is the uniform result shape
 * produced by the result aggregator, tagged with a
 * {@link com.phillippitts.speechstream.domain.ResultType}.
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.domain;
