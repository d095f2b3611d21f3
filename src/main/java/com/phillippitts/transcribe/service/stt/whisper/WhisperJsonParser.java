package com.phillippitts.transcribe.service.stt.whisper;

import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.service.stt.EngineSegment;
import com.phillippitts.transcribe.service.stt.EngineTranscription;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Parses the document written by {@code whisper-cli -oj}.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "result": { "language": "it" },
 *   "transcription": [
 *     { "offsets": { "from": 0, "to": 2140 }, "text": " Ciao a tutti." },
 *     ...
 *   ]
 * }
 * </pre>
 *
 * <p>Segments are mapped one by one as the returned iterator advances. Offsets are
 * milliseconds and are converted to seconds; the segment id is its array index.
 */
final class WhisperJsonParser {

    private static final double MILLIS_PER_SECOND = 1000.0;

    private WhisperJsonParser() {}

    /**
     * Parses whisper.cpp JSON output.
     *
     * @param json document content
     * @return lazily mapped segments plus the reported language (null when absent or blank)
     * @throws InferenceException if the document is blank or not a JSON object
     */
    static EngineTranscription parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InferenceException("Empty JSON output", WhisperConstants.ENGINE_NAME);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new InferenceException("Malformed JSON output", WhisperConstants.ENGINE_NAME, e);
        }

        String language = null;
        JSONObject result = obj.optJSONObject("result");
        if (result != null) {
            String lang = result.optString("language", "");
            if (!lang.isBlank()) {
                language = lang.trim();
            }
        }

        JSONArray segments = obj.optJSONArray("transcription");
        return new EngineTranscription(new SegmentIterator(segments), language);
    }

    /**
     * Forward-only view over the {@code transcription} array. Entries that are not
     * objects are skipped.
     */
    private static final class SegmentIterator implements Iterator<EngineSegment> {
        private final JSONArray array;
        private int index;
        private JSONObject next;

        SegmentIterator(JSONArray array) {
            this.array = array;
        }

        @Override
        public boolean hasNext() {
            if (array == null) {
                return false;
            }
            while (next == null && index < array.length()) {
                next = array.optJSONObject(index);
                if (next == null) {
                    index++;
                }
            }
            return next != null;
        }

        @Override
        public EngineSegment next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JSONObject seg = next;
            int id = index;
            next = null;
            index++;
            return toSegment(id, seg);
        }
    }

    private static EngineSegment toSegment(int id, JSONObject seg) {
        double start = 0.0;
        double end = 0.0;
        JSONObject offsets = seg.optJSONObject("offsets");
        if (offsets != null) {
            start = offsets.optLong("from", 0L) / MILLIS_PER_SECOND;
            end = offsets.optLong("to", 0L) / MILLIS_PER_SECOND;
        }
        return new EngineSegment(id, start, end, seg.optString("text", ""));
    }
}
