package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;

/**
 * Remote controls (the abstraction) operating devices (the implementation). Either side can
 * gain new variants without touching the other.
 */
public class BridgeDemo extends AbstractPatternDemo {

    public BridgeDemo(DemoContext context) {
        super(context, "Bridge",
                "Separates abstraction from implementation so both can vary independently.");
    }

    @Override
    public void demonstrate() {
        out.println("Remote Control Bridge Example");

        Device tv = new Tv(out);
        Device radio = new Radio(out);

        BasicRemote basicRemote = new BasicRemote(tv);
        AdvancedRemote advancedRemote = new AdvancedRemote(radio);

        basicRemote.power();
        basicRemote.volumeUp();

        advancedRemote.power();
        advancedRemote.mute();

        out.println("Swapping devices: advanced remote now drives the TV");
        AdvancedRemote tvRemote = new AdvancedRemote(tv);
        tvRemote.mute();
        tvRemote.power();
    }

    static class BasicRemote {
        protected final Device device;

        BasicRemote(Device device) {
            this.device = device;
        }

        void power() {
            if (device.isEnabled()) {
                device.disable();
            } else {
                device.enable();
            }
        }

        void volumeUp() {
            device.setVolume(device.volume() + 10);
        }

        void volumeDown() {
            device.setVolume(device.volume() - 10);
        }
    }

    static class AdvancedRemote extends BasicRemote {
        AdvancedRemote(Device device) {
            super(device);
        }

        void mute() {
            device.setVolume(0);
        }
    }

    interface Device {
        boolean isEnabled();

        void enable();

        void disable();

        int volume();

        void setVolume(int volume);
    }

    /**
     * Shared device state; volume is kept within 0..100.
     */
    abstract static class AbstractDevice implements Device {
        private final PrintStream out;
        private final String label;
        private boolean enabled;
        private int volume;

        AbstractDevice(PrintStream out, String label, int volume) {
            this.out = out;
            this.label = label;
            this.volume = volume;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public void enable() {
            enabled = true;
            out.println(label + " is ON");
        }

        @Override
        public void disable() {
            enabled = false;
            out.println(label + " is OFF");
        }

        @Override
        public int volume() {
            return volume;
        }

        @Override
        public void setVolume(int volume) {
            this.volume = Math.max(0, Math.min(100, volume));
            out.println(label + " volume: " + this.volume);
        }
    }

    static final class Tv extends AbstractDevice {
        Tv(PrintStream out) {
            super(out, "TV", 50);
        }
    }

    static final class Radio extends AbstractDevice {
        Radio(PrintStream out) {
            super(out, "Radio", 30);
        }
    }
}
