package com.phillippitts.speechstream.service.stt.result;

import com.phillippitts.speechstream.domain.RecognitionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Maps the engine's native JSON documents to {@link RecognitionResult}s.
 *
 * <p>Handles two Vosk response shapes:
 * <ul>
 *   <li><b>Partial:</b> {@code {"partial": "hello wor"}}</li>
 *   <li><b>Final:</b> {@code {"text": "hello world", "result": [{"conf": 0.98, "word": "hello"}, ...]}}</li>
 * </ul>
 *
 * <p>Never throws on engine output: absent or malformed JSON yields empty text with no
 * confidence.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> Caps JSON at {@link #MAX_JSON_SIZE} (1MB) before parsing.
 *
 * @since 1.0
 */
public final class ResultAggregator {

    private static final Logger LOG = LogManager.getLogger(ResultAggregator.class);

    /**
     * Maximum allowed JSON response size from the recognizer (1MB).
     */
    static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private ResultAggregator() {
        // Utility class - prevent instantiation
    }

    /**
     * @param json output of {@code EngineHandle.partialResult()}
     * @return partial result; text from the {@code partial} field, never a confidence
     */
    public static RecognitionResult fromPartial(String json) {
        JSONObject obj = parse(json);
        if (obj == null) {
            return RecognitionResult.emptyPartial();
        }
        return RecognitionResult.partial(obj.optString("partial", "").trim());
    }

    /**
     * @param json output of {@code EngineHandle.result()} or {@code finalResult()}
     * @return final result; text from the {@code text} field, confidence from a top-level
     *         {@code confidence} field or else the mean word-level {@code conf}, absent if neither
     */
    public static RecognitionResult fromFinal(String json) {
        JSONObject obj = parse(json);
        if (obj == null) {
            return RecognitionResult.emptyFinal();
        }
        String text = obj.optString("text", "").trim();
        return RecognitionResult.finalResult(text, extractConfidence(obj));
    }

    private static JSONObject parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        json = truncateJsonIfNeeded(json);
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("Failed to parse recognizer JSON ({} chars): {}", json.length(), e.getMessage());
            return null;
        }
    }

    private static String truncateJsonIfNeeded(String json) {
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Recognizer JSON exceeds {}B cap (actual: {}B); truncating",
                    MAX_JSON_SIZE, json.length());
            return json.substring(0, MAX_JSON_SIZE);
        }
        return json;
    }

    /**
     * @return confidence clamped to [0.0, 1.0], or null when the document carries none
     */
    private static Double extractConfidence(JSONObject obj) {
        if (obj.has("confidence")) {
            double raw = obj.optDouble("confidence", Double.NaN);
            return Double.isNaN(raw) ? null : clamp(raw);
        }
        JSONArray words = obj.optJSONArray("result");
        if (words == null || words.isEmpty()) {
            return null;
        }

        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < words.length(); i++) {
            JSONObject word = words.optJSONObject(i);
            if (word != null && word.has("conf")) {
                double conf = word.optDouble("conf", Double.NaN);
                if (!Double.isNaN(conf)) {
                    sum += conf;
                    count++;
                }
            }
        }
        return count > 0 ? clamp(sum / count) : null;
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
