package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;

/**
 * A home theater: one call on the facade drives five subsystems in the right order.
 */
public class FacadeDemo extends AbstractPatternDemo {

    public FacadeDemo(DemoContext context) {
        super(context, "Facade", "Provides a simplified interface to a complex subsystem.");
    }

    @Override
    public void demonstrate() {
        out.println("Home Theater Facade Example");

        HomeTheaterFacade homeTheater = new HomeTheaterFacade(out);
        homeTheater.watchMovie("The Matrix");
        out.println();
        homeTheater.endMovie();
    }

    static final class HomeTheaterFacade {
        private final PrintStream out;
        private final Amplifier amp;
        private final DvdPlayer dvd;
        private final Projector projector;
        private final Lights lights;
        private final Screen screen;

        HomeTheaterFacade(PrintStream out) {
            this.out = out;
            this.amp = new Amplifier(out);
            this.dvd = new DvdPlayer(out);
            this.projector = new Projector(out);
            this.lights = new Lights(out);
            this.screen = new Screen(out);
        }

        void watchMovie(String movie) {
            out.println("Get ready to watch a movie...");
            lights.dim(10);
            screen.down();
            projector.on();
            projector.setInput(dvd);
            amp.on();
            amp.setVolume(5);
            dvd.on();
            dvd.play(movie);
        }

        void endMovie() {
            out.println("Shutting movie theater down...");
            dvd.stop();
            dvd.off();
            amp.off();
            projector.off();
            screen.up();
            lights.on();
        }
    }

    record Amplifier(PrintStream out) {
        void on() {
            out.println("  Amplifier on");
        }

        void off() {
            out.println("  Amplifier off");
        }

        void setVolume(int level) {
            out.println("  Setting volume to " + level);
        }
    }

    record DvdPlayer(PrintStream out) {
        void on() {
            out.println("  DVD Player on");
        }

        void off() {
            out.println("  DVD Player off");
        }

        void play(String movie) {
            out.println("  Playing '" + movie + "'");
        }

        void stop() {
            out.println("  Stopped");
        }
    }

    record Projector(PrintStream out) {
        void on() {
            out.println("  Projector on");
        }

        void off() {
            out.println("  Projector off");
        }

        void setInput(DvdPlayer dvd) {
            out.println("  Setting DVD input");
        }
    }

    record Lights(PrintStream out) {
        void on() {
            out.println("  Lights on");
        }

        void dim(int level) {
            out.println("  Dimming to " + level + "%");
        }
    }

    record Screen(PrintStream out) {
        void up() {
            out.println("  Screen going up");
        }

        void down() {
            out.println("  Screen going down");
        }
    }
}
