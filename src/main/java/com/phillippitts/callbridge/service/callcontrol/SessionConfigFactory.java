package com.phillippitts.callbridge.service.callcontrol;

import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

/**
 * Builds the session configuration sent with an accept request.
 *
 * <pre>
 * {
 *   "type": "realtime",
 *   "model": ...,
 *   "instructions": ...,
 *   "audio": {
 *     "input":  {"format": {"type": ...}, "turn_detection": {"type": ...}},
 *     "output": {"format": {"type": ...}, "voice": ...}
 *   },
 *   "tools": [...]
 * }
 * </pre>
 */
@Component
public class SessionConfigFactory {

    private final RealtimeProperties properties;

    public SessionConfigFactory(RealtimeProperties properties) {
        this.properties = properties;
    }

    public JSONObject build(String instructions, JSONArray tools) {
        JSONObject format = new JSONObject().put("type", properties.getAudioFormat());
        JSONObject input = new JSONObject()
                .put("format", format)
                .put("turn_detection", new JSONObject().put("type", properties.getTurnDetection()));
        JSONObject output = new JSONObject()
                .put("format", new JSONObject().put("type", properties.getAudioFormat()))
                .put("voice", properties.getVoice());

        return new JSONObject()
                .put("type", "realtime")
                .put("model", properties.getModel())
                .put("instructions", instructions)
                .put("audio", new JSONObject().put("input", input).put("output", output))
                .put("tools", tools != null ? tools : new JSONArray());
    }
}
