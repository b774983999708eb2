/**
 * Translation of recognizer JSON into {@link com.phillippitts.speechstream.domain.RecognitionResult}.
 */
package com.phillippitts.speechstream.service.stt.result;
