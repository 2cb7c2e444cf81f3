package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.behavioral.CommandDemo.CommandScheduler;
import org.javai.gof.patterns.behavioral.CommandDemo.LightOffCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.LightOnCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.MacroCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.MusicSystem;
import org.javai.gof.patterns.behavioral.CommandDemo.PlayMusicCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.SetTemperatureCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.SetVolumeCommand;
import org.javai.gof.patterns.behavioral.CommandDemo.SmartHomeRemote;
import org.javai.gof.patterns.behavioral.CommandDemo.SmartLight;
import org.javai.gof.patterns.behavioral.CommandDemo.Thermostat;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CommandDemoTest {

    private final PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

    @Test
    void undo_restoresPreviousLightState() {
        SmartLight light = new SmartLight(out, "Bedroom");
        SmartHomeRemote remote = new SmartHomeRemote(out);

        remote.setCommand(new LightOnCommand(light, 100));
        remote.pressButton();
        remote.setCommand(new LightOnCommand(light, 40));
        remote.pressButton();
        remote.setCommand(new LightOffCommand(light));
        remote.pressButton();

        assertThat(remote.pressUndo()).isTrue();
        assertThat(light.isOn()).isTrue();
        assertThat(light.brightness()).isEqualTo(40);

        assertThat(remote.pressUndo()).isTrue();
        assertThat(light.brightness()).isEqualTo(100);

        assertThat(remote.pressUndo()).isTrue();
        assertThat(light.isOn()).isFalse();
        assertThat(remote.historySize()).isZero();
    }

    @Test
    void undo_withEmptyHistory_returnsFalse() {
        assertThat(new SmartHomeRemote(out).pressUndo()).isFalse();
    }

    @Test
    void defaultCommand_doesNothing() {
        SmartHomeRemote remote = new SmartHomeRemote(out);

        remote.pressButton();

        assertThat(remote.historySize()).isEqualTo(1);
    }

    @Test
    void thermostat_clampsToSupportedRange() {
        Thermostat thermostat = new Thermostat(out, "Main");

        new SetTemperatureCommand(thermostat, 120).execute();
        assertThat(thermostat.temperature()).isEqualTo(85);

        new SetTemperatureCommand(thermostat, 10).execute();
        assertThat(thermostat.temperature()).isEqualTo(50);
    }

    @Test
    void macro_undoesInReverseOrder() {
        MusicSystem music = new MusicSystem(out, "Sonos");
        Thermostat thermostat = new Thermostat(out, "Main");
        MacroCommand macro = new MacroCommand(out, "Party", List.of(
                new PlayMusicCommand(music, "Dance"),
                new SetVolumeCommand(music, 80),
                new SetTemperatureCommand(thermostat, 66)));

        macro.execute();
        assertThat(music.playlist()).isEqualTo("Dance");
        assertThat(music.volume()).isEqualTo(80);
        assertThat(thermostat.temperature()).isEqualTo(66);

        macro.undo();
        assertThat(music.playlist()).isNull();
        assertThat(music.volume()).isEqualTo(50);
        assertThat(thermostat.temperature()).isEqualTo(70);
        assertThat(macro.description()).isEqualTo("Macro: Party (3 commands)");
    }

    @Test
    void scheduler_runsInSlotOrder() throws InterruptedException {
        SmartLight light = new SmartLight(out, "Hall");
        CommandScheduler scheduler = new CommandScheduler(out, DemoContext.immediate(out));
        scheduler.schedule(new LightOffCommand(light), 3, "late");
        scheduler.schedule(new LightOnCommand(light, 70), 1, "early");
        scheduler.schedule(new SetTemperatureCommand(new Thermostat(out, "Hall"), 60), 2, "middle");

        assertThat(scheduler.runAll()).containsExactly("early", "middle", "late");
        assertThat(light.isOn()).isFalse();
        assertThat(scheduler.runAll()).isEmpty();
    }
}
