package com.phillippitts.callbridge.service.callcontrol;

import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionConfigFactoryTest {

    @Test
    void buildsRealtimeSessionFromProperties() {
        RealtimeProperties props = new RealtimeProperties();
        props.setModel("gpt-realtime");
        props.setVoice("alloy");
        JSONArray tools = new JSONArray().put(new JSONObject().put("name", "transfer_call"));

        JSONObject session = new SessionConfigFactory(props).build("Be helpful.", tools);

        assertThat(session.getString("type")).isEqualTo("realtime");
        assertThat(session.getString("model")).isEqualTo("gpt-realtime");
        assertThat(session.getString("instructions")).isEqualTo("Be helpful.");
        JSONObject audio = session.getJSONObject("audio");
        assertThat(audio.getJSONObject("input").getJSONObject("format").getString("type")).isEqualTo("audio/pcmu");
        assertThat(audio.getJSONObject("input").getJSONObject("turn_detection").getString("type"))
                .isEqualTo("server_vad");
        assertThat(audio.getJSONObject("output").getString("voice")).isEqualTo("alloy");
        assertThat(session.getJSONArray("tools").length()).isEqualTo(1);
    }

    @Test
    void missingToolsBecomeEmptyList() {
        JSONObject session = new SessionConfigFactory(new RealtimeProperties()).build("", null);

        assertThat(session.getJSONArray("tools").isEmpty()).isTrue();
    }
}
