package com.phillippitts.streamtalker.service.playback;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VolumeMixerTest {

    @Test
    void unsetVoicePlaysAtGlobalVolume() {
        VolumeMixer mixer = new VolumeMixer(80, Map.of());

        assertThat(mixer.volumeFor("anyone")).isEqualTo(0.8f);
        assertThat(mixer.voicePercent("anyone")).isEqualTo(100);
    }

    @Test
    void multipliesGlobalAndVoice() {
        VolumeMixer mixer = new VolumeMixer(50, Map.of("Bob", 40));

        assertThat(mixer.volumeFor("bob")).isEqualTo(0.2f);
        assertThat(mixer.volumeFor("BOB")).isEqualTo(0.2f);
    }

    @Test
    void zeroGlobalMutesEverything() {
        VolumeMixer mixer = new VolumeMixer(100, Map.of("bob", 100));
        mixer.setGlobalPercent(0);

        assertThat(mixer.volumeFor("bob")).isZero();
    }

    @Test
    void rejectsOutOfRangePercent() {
        VolumeMixer mixer = new VolumeMixer(100, Map.of());

        assertThatThrownBy(() -> mixer.setGlobalPercent(101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mixer.setVoicePercent("bob", -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VolumeMixer(100, Map.of("bob", 150)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposesVoiceSettings() {
        VolumeMixer mixer = new VolumeMixer(100, Map.of());
        mixer.setVoicePercent("Alice", 30);

        assertThat(mixer.voicePercents()).containsEntry("alice", 30);
        assertThat(mixer.globalPercent()).isEqualTo(100);
    }
}
