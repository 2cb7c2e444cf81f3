package org.javai.gof.patterns.structural;

import org.javai.gof.patterns.structural.BridgeDemo.AdvancedRemote;
import org.javai.gof.patterns.structural.BridgeDemo.BasicRemote;
import org.javai.gof.patterns.structural.BridgeDemo.Radio;
import org.javai.gof.patterns.structural.BridgeDemo.Tv;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class BridgeDemoTest {

    private final PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

    @Test
    void power_togglesDevice() {
        Tv tv = new Tv(out);
        BasicRemote remote = new BasicRemote(tv);

        remote.power();
        assertThat(tv.isEnabled()).isTrue();

        remote.power();
        assertThat(tv.isEnabled()).isFalse();
    }

    @Test
    void volume_isClampedToRange() {
        Radio radio = new Radio(out);
        AdvancedRemote remote = new AdvancedRemote(radio);

        for (int i = 0; i < 10; i++) {
            remote.volumeUp();
        }
        assertThat(radio.volume()).isEqualTo(100);

        remote.mute();
        remote.volumeDown();
        assertThat(radio.volume()).isZero();
    }

    @Test
    void sameRemoteWorksWithAnyDevice() {
        Tv tv = new Tv(out);
        Radio radio = new Radio(out);

        new BasicRemote(tv).volumeUp();
        new BasicRemote(radio).volumeUp();

        assertThat(tv.volume()).isEqualTo(60);
        assertThat(radio.volume()).isEqualTo(40);
    }
}
