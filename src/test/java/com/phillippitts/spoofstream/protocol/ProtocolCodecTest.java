package com.phillippitts.spoofstream.protocol;

import com.phillippitts.spoofstream.exception.ProtocolViolationException;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolCodecTest {

    @Test
    void decodesConnect() {
        InboundMessage msg = ProtocolCodec.decode("{\"type\":\"connect\",\"client_id\":\"alice\",\"timestamp\":1.5}");

        assertThat(msg).isInstanceOf(InboundMessage.Connect.class);
        InboundMessage.Connect connect = (InboundMessage.Connect) msg;
        assertThat(connect.clientId()).isEqualTo("alice");
        assertThat(connect.timestamp()).isEqualTo(1.5);
        assertThat(msg.type()).isEqualTo(InboundMessageType.CONNECT);
    }

    @Test
    void decodesAudioChunkWithOptionalFieldsMissing() {
        InboundMessage.AudioChunk chunk = (InboundMessage.AudioChunk)
                ProtocolCodec.decode("{\"type\":\"audio_chunk\",\"audio_data\":\"AAAAAA==\"}");

        assertThat(chunk.audioData()).isEqualTo("AAAAAA==");
        assertThat(chunk.encoding()).isNull();
        assertThat(chunk.sampleRate()).isNull();
        assertThat(chunk.clientId()).isNull();
    }

    @Test
    void keepsJsonArrayAudioDataAsArray() {
        InboundMessage.AudioChunk chunk = (InboundMessage.AudioChunk) ProtocolCodec.decode(
                "{\"type\":\"audio_chunk\",\"encoding\":\"json\",\"sample_rate\":16000,\"audio_data\":[0.1,0.2]}");

        assertThat(chunk.audioData()).isInstanceOf(JSONArray.class);
        assertThat(chunk.sampleRate()).isEqualTo(16_000);
    }

    @Test
    void decodesConfigWithPartialFields() {
        InboundMessage.Config config = (InboundMessage.Config)
                ProtocolCodec.decode("{\"type\":\"config\",\"chunk_duration\":2,\"overlap_duration\":0.5}");

        assertThat(config.chunkDuration()).isEqualTo(2.0);
        assertThat(config.overlapDuration()).isEqualTo(0.5);
        assertThat(config.sampleRate()).isNull();
        assertThat(config.minDuration()).isNull();
        assertThat(config.isEmpty()).isFalse();
        assertThat(((InboundMessage.Config) ProtocolCodec.decode("{\"type\":\"config\"}")).isEmpty()).isTrue();
    }

    @Test
    void decodesPingAndStats() {
        assertThat(ProtocolCodec.decode("{\"type\":\"ping\"}")).isInstanceOf(InboundMessage.Ping.class);
        assertThat(ProtocolCodec.decode("{\"type\":\"stats\"}")).isInstanceOf(InboundMessage.StatsRequest.class);
    }

    @Test
    void rejectsTextThatIsNotAJsonObject() {
        assertThatThrownBy(() -> ProtocolCodec.decode("not json"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> ProtocolCodec.decode("[1,2]"))
                .isInstanceOf(ProtocolViolationException.class);
        assertThatThrownBy(() -> ProtocolCodec.decode(null))
                .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void rejectsMissingAndUnknownTypes() {
        assertThatThrownBy(() -> ProtocolCodec.decode("{\"client_id\":\"a\"}"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("Missing message type");
        assertThatThrownBy(() -> ProtocolCodec.decode("{\"type\":\"subscribe\"}"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("Unknown message type: subscribe")
                .satisfies(e -> assertThat(((ProtocolViolationException) e).getMessageType()).isEqualTo("subscribe"));
    }

    @Test
    void rejectsWrongFieldTypes() {
        assertThatThrownBy(() -> ProtocolCodec.decode("{\"type\":\"connect\",\"client_id\":42}"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("'client_id' must be a string");
        assertThatThrownBy(() -> ProtocolCodec.decode("{\"type\":\"audio_chunk\",\"sample_rate\":\"fast\"}"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("'sample_rate' must be a number");
        assertThatThrownBy(() -> ProtocolCodec.decode("{\"type\":\"config\",\"sample_rate\":16000.5}"))
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("must be an integer");
    }
}
