package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Smart home automation: device commands, macros, an undo history on the remote, and a
 * scheduler that runs queued commands in time order.
 */
public class CommandDemo extends AbstractPatternDemo {

    public CommandDemo(DemoContext context) {
        super(context, "Command",
                "Encapsulates a request as an object, allowing you to parameterize clients with different requests, "
                        + "queue or log requests, and support undo operations. Useful for implementing macro commands, "
                        + "undo/redo functionality, and decoupling the invoker from the receiver.");
    }

    @Override
    public void demonstrate() throws InterruptedException {
        out.println("Smart Home Automation Command Example");
        out.println();

        demonstrateBasicCommands();
        out.println();
        demonstrateMacroCommands();
        out.println();
        demonstrateUndo();
        out.println();
        demonstrateScheduledQueue();
    }

    private void demonstrateBasicCommands() {
        out.println("Basic Device Commands:");
        SmartLight livingRoom = new SmartLight(out, "Living Room");
        SmartLight kitchen = new SmartLight(out, "Kitchen");
        Thermostat thermostat = new Thermostat(out, "Main");
        MusicSystem music = new MusicSystem(out, "Sonos");

        SmartHomeRemote remote = new SmartHomeRemote(out);
        for (Command command : List.of(
                new LightOnCommand(livingRoom, 100),
                new LightOffCommand(kitchen),
                new SetTemperatureCommand(thermostat, 72),
                new PlayMusicCommand(music, "Classical Playlist"),
                new SetVolumeCommand(music, 60))) {
            remote.setCommand(command);
            remote.pressButton();
        }
    }

    private void demonstrateMacroCommands() {
        out.println("Macro Commands (Multiple Actions):");
        SmartLight livingRoom = new SmartLight(out, "Living Room");
        SmartLight kitchen = new SmartLight(out, "Kitchen");
        Thermostat thermostat = new Thermostat(out, "Main");
        MusicSystem music = new MusicSystem(out, "Home Audio");
        SmartHomeRemote remote = new SmartHomeRemote(out);

        remote.setCommand(new MacroCommand(out, "Movie Night", List.of(
                new LightOffCommand(livingRoom),
                new LightOnCommand(kitchen, 20),
                new SetTemperatureCommand(thermostat, 68),
                new PlayMusicCommand(music, "Movie Soundtracks"),
                new SetVolumeCommand(music, 40))));
        remote.pressButton();
        out.println();

        remote.setCommand(new MacroCommand(out, "Good Morning", List.of(
                new LightOnCommand(livingRoom, 80),
                new LightOnCommand(kitchen, 100),
                new SetTemperatureCommand(thermostat, 70),
                new PlayMusicCommand(music, "Morning Jazz"),
                new SetVolumeCommand(music, 50))));
        remote.pressButton();

        out.println();
        remote.pressUndo();
    }

    private void demonstrateUndo() {
        out.println("Undo Functionality:");
        SmartLight bedroom = new SmartLight(out, "Bedroom");
        SmartHomeRemote remote = new SmartHomeRemote(out);

        for (Command command : List.of(
                new LightOnCommand(bedroom, 100),
                new LightOffCommand(bedroom),
                new LightOnCommand(bedroom, 50),
                new LightOnCommand(bedroom, 100))) {
            remote.setCommand(command);
            remote.pressButton();
        }

        out.println();
        out.println("  Undoing last 3 commands:");
        for (int i = 0; i < 3; i++) {
            remote.pressUndo();
        }
        out.println("  Bedroom light is " + (bedroom.isOn() ? "ON at " + bedroom.brightness() + "%" : "OFF"));
    }

    private void demonstrateScheduledQueue() throws InterruptedException {
        out.println("Scheduled Command Queue:");
        SmartLight livingRoom = new SmartLight(out, "Living Room");
        Thermostat thermostat = new Thermostat(out, "Main");
        MusicSystem music = new MusicSystem(out, "Home Audio");

        CommandScheduler scheduler = new CommandScheduler(out, context);
        scheduler.schedule(new PlayMusicCommand(music, "Wake Up Playlist"), 3, "Start music");
        scheduler.schedule(new LightOnCommand(livingRoom, 100), 1, "Morning lights");
        scheduler.schedule(new SetTemperatureCommand(thermostat, 68), 2, "Lower temperature");

        out.println("  Commands scheduled. Executing queue...");
        scheduler.runAll();
    }

    interface Command {
        void execute();

        void undo();

        String description();
    }

    // Receivers

    static final class SmartLight {
        private final PrintStream out;
        private final String location;
        private boolean on;
        private int brightness = 100;

        SmartLight(PrintStream out, String location) {
            this.out = out;
            this.location = location;
        }

        void turnOn(int brightness) {
            this.on = true;
            this.brightness = Math.max(0, Math.min(100, brightness));
            out.println("    " + location + " light turned ON (brightness: " + this.brightness + "%)");
        }

        void turnOff() {
            this.on = false;
            out.println("    " + location + " light turned OFF");
        }

        boolean isOn() {
            return on;
        }

        int brightness() {
            return brightness;
        }

        String location() {
            return location;
        }
    }

    static final class Thermostat {
        private final PrintStream out;
        private final String zone;
        private int temperature = 70;

        Thermostat(PrintStream out, String zone) {
            this.out = out;
            this.zone = zone;
        }

        void setTemperature(int requested) {
            int previous = temperature;
            temperature = Math.max(50, Math.min(85, requested));
            String trend = temperature > previous ? "warming" : temperature < previous ? "cooling" : "steady";
            out.println("    " + zone + " thermostat set to " + temperature + "F (" + trend + ")");
        }

        int temperature() {
            return temperature;
        }

        String zone() {
            return zone;
        }
    }

    static final class MusicSystem {
        private final PrintStream out;
        private final String name;
        private String playlist;
        private int volume = 50;

        MusicSystem(PrintStream out, String name) {
            this.out = out;
            this.name = name;
        }

        void play(String playlist) {
            this.playlist = playlist;
            out.println("    " + name + " playing: " + playlist);
        }

        void stop() {
            this.playlist = null;
            out.println("    " + name + " stopped");
        }

        void setVolume(int volume) {
            this.volume = Math.max(0, Math.min(100, volume));
            out.println("    " + name + " volume set to " + this.volume + "%");
        }

        String playlist() {
            return playlist;
        }

        int volume() {
            return volume;
        }

        String name() {
            return name;
        }
    }

    // Commands

    static final class LightOnCommand implements Command {
        private final SmartLight light;
        private final int brightness;
        private boolean wasOn;
        private int previousBrightness;

        LightOnCommand(SmartLight light, int brightness) {
            this.light = light;
            this.brightness = brightness;
        }

        @Override
        public void execute() {
            wasOn = light.isOn();
            previousBrightness = light.brightness();
            light.turnOn(brightness);
        }

        @Override
        public void undo() {
            if (wasOn) {
                light.turnOn(previousBrightness);
            } else {
                light.turnOff();
            }
        }

        @Override
        public String description() {
            return "Turn on " + light.location() + " light (brightness: " + brightness + "%)";
        }
    }

    static final class LightOffCommand implements Command {
        private final SmartLight light;
        private boolean wasOn;
        private int previousBrightness;

        LightOffCommand(SmartLight light) {
            this.light = light;
        }

        @Override
        public void execute() {
            wasOn = light.isOn();
            previousBrightness = light.brightness();
            light.turnOff();
        }

        @Override
        public void undo() {
            if (wasOn) {
                light.turnOn(previousBrightness);
            }
        }

        @Override
        public String description() {
            return "Turn off " + light.location() + " light";
        }
    }

    static final class SetTemperatureCommand implements Command {
        private final Thermostat thermostat;
        private final int temperature;
        private int previousTemperature;

        SetTemperatureCommand(Thermostat thermostat, int temperature) {
            this.thermostat = thermostat;
            this.temperature = temperature;
        }

        @Override
        public void execute() {
            previousTemperature = thermostat.temperature();
            thermostat.setTemperature(temperature);
        }

        @Override
        public void undo() {
            thermostat.setTemperature(previousTemperature);
        }

        @Override
        public String description() {
            return "Set " + thermostat.zone() + " thermostat to " + temperature + "F";
        }
    }

    static final class PlayMusicCommand implements Command {
        private final MusicSystem music;
        private final String playlist;
        private String previousPlaylist;

        PlayMusicCommand(MusicSystem music, String playlist) {
            this.music = music;
            this.playlist = playlist;
        }

        @Override
        public void execute() {
            previousPlaylist = music.playlist();
            music.play(playlist);
        }

        @Override
        public void undo() {
            if (previousPlaylist != null) {
                music.play(previousPlaylist);
            } else {
                music.stop();
            }
        }

        @Override
        public String description() {
            return "Play " + playlist + " on " + music.name();
        }
    }

    static final class SetVolumeCommand implements Command {
        private final MusicSystem music;
        private final int volume;
        private int previousVolume;

        SetVolumeCommand(MusicSystem music, int volume) {
            this.music = music;
            this.volume = volume;
        }

        @Override
        public void execute() {
            previousVolume = music.volume();
            music.setVolume(volume);
        }

        @Override
        public void undo() {
            music.setVolume(previousVolume);
        }

        @Override
        public String description() {
            return "Set " + music.name() + " volume to " + volume + "%";
        }
    }

    /**
     * Runs its commands in order and undoes them in reverse.
     */
    static final class MacroCommand implements Command {
        private final PrintStream out;
        private final String name;
        private final List<Command> commands;

        MacroCommand(PrintStream out, String name, List<Command> commands) {
            this.out = out;
            this.name = name;
            this.commands = List.copyOf(commands);
        }

        @Override
        public void execute() {
            out.println("    Executing macro: " + name);
            commands.forEach(Command::execute);
        }

        @Override
        public void undo() {
            out.println("    Undoing macro: " + name);
            for (int i = commands.size() - 1; i >= 0; i--) {
                commands.get(i).undo();
            }
        }

        @Override
        public String description() {
            return "Macro: " + name + " (" + commands.size() + " commands)";
        }
    }

    static final class NoCommand implements Command {
        @Override
        public void execute() {
        }

        @Override
        public void undo() {
        }

        @Override
        public String description() {
            return "No command";
        }
    }

    // Invokers

    static final class SmartHomeRemote {
        private final PrintStream out;
        private final Deque<Command> history = new ArrayDeque<>();
        private Command command = new NoCommand();

        SmartHomeRemote(PrintStream out) {
            this.out = out;
        }

        void setCommand(Command command) {
            this.command = command;
        }

        void pressButton() {
            out.println("  Executing: " + command.description());
            command.execute();
            history.push(command);
        }

        boolean pressUndo() {
            Command last = history.poll();
            if (last == null) {
                out.println("  Nothing to undo");
                return false;
            }
            out.println("  Undoing: " + last.description());
            last.undo();
            return true;
        }

        int historySize() {
            return history.size();
        }
    }

    /**
     * Queue of commands ordered by the slot they are due in. One slot is one context pause.
     */
    static final class CommandScheduler {
        private final PrintStream out;
        private final DemoContext context;
        private final List<ScheduledCommand> queue = new ArrayList<>();

        CommandScheduler(PrintStream out, DemoContext context) {
            this.out = out;
            this.context = context;
        }

        void schedule(Command command, int slot, String label) {
            queue.add(new ScheduledCommand(command, slot, label));
            out.println("    Scheduled: " + command.description() + " in slot " + slot);
        }

        List<String> runAll() throws InterruptedException {
            List<String> executed = new ArrayList<>();
            if (queue.isEmpty()) {
                out.println("    No commands ready for execution");
                return executed;
            }
            queue.sort(Comparator.comparingInt(ScheduledCommand::slot));
            int currentSlot = 0;
            for (ScheduledCommand scheduled : queue) {
                context.pause(scheduled.slot() - currentSlot);
                currentSlot = scheduled.slot();
                out.println("    Executing scheduled: " + scheduled.label());
                scheduled.command().execute();
                executed.add(scheduled.label());
            }
            queue.clear();
            return executed;
        }

        private record ScheduledCommand(Command command, int slot, String label) {}
    }
}
