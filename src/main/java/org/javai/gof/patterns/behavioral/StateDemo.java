package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;

/**
 * A traffic light whose current state decides both what it shows and which state comes next.
 */
public class StateDemo extends AbstractPatternDemo {

    static final int CYCLES = 6;

    public StateDemo(DemoContext context) {
        super(context, "State", "Allows an object to alter its behavior when its internal state changes.");
    }

    @Override
    public void demonstrate() throws InterruptedException {
        out.println("Traffic Light State Example");

        TrafficLight trafficLight = new TrafficLight(out);
        for (int i = 0; i < CYCLES; i++) {
            trafficLight.request();
            context.pause();
        }
    }

    interface TrafficLightState {
        void handle(TrafficLight light);
    }

    static final class TrafficLight {
        private final PrintStream out;
        private TrafficLightState state = new RedState();

        TrafficLight(PrintStream out) {
            this.out = out;
            out.println("Traffic light initialized");
        }

        void setState(TrafficLightState state) {
            this.state = state;
        }

        TrafficLightState state() {
            return state;
        }

        void request() {
            state.handle(this);
        }

        void show(String message) {
            out.println(message);
        }
    }

    static final class RedState implements TrafficLightState {
        @Override
        public void handle(TrafficLight light) {
            light.show("RED - Stop! Changing to Green...");
            light.setState(new GreenState());
        }
    }

    static final class GreenState implements TrafficLightState {
        @Override
        public void handle(TrafficLight light) {
            light.show("GREEN - Go! Changing to Yellow...");
            light.setState(new YellowState());
        }
    }

    static final class YellowState implements TrafficLightState {
        @Override
        public void handle(TrafficLight light) {
            light.show("YELLOW - Caution! Changing to Red...");
            light.setState(new RedState());
        }
    }
}
