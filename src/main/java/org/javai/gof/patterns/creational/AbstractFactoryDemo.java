package org.javai.gof.patterns.creational;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;

/**
 * Cross-platform UI widgets: each factory produces a button, text box and window that
 * belong to the same look and feel.
 */
public class AbstractFactoryDemo extends AbstractPatternDemo {

    public AbstractFactoryDemo(DemoContext context) {
        super(context, "Abstract Factory",
                "Creates families of related objects without specifying their concrete classes. "
                        + "Useful when you need to ensure that products from the same family are used together "
                        + "and to make the system independent of how its products are created.");
    }

    @Override
    public void demonstrate() {
        out.println("Cross-Platform UI Component Factory Example");
        out.println();

        renderTheme(new WindowsThemeFactory(out), "Windows");
        out.println();
        renderTheme(new MacThemeFactory(out), "macOS");
        out.println();
        renderTheme(new LinuxThemeFactory(out), "Linux");
    }

    private void renderTheme(ThemeFactory factory, String themeName) {
        out.println("Creating " + themeName + " UI components:");

        Button button = factory.createButton();
        TextBox textBox = factory.createTextBox();
        Window window = factory.createWindow();

        button.render();
        textBox.render();
        window.render();
        textBox.setText("Hello from " + themeName);
        button.click();

        out.println("All components share the " + themeName + " styling.");
    }

    interface Button {
        void render();

        void click();
    }

    interface TextBox {
        void render();

        void setText(String text);
    }

    interface Window {
        void render();
    }

    interface ThemeFactory {
        Button createButton();

        TextBox createTextBox();

        Window createWindow();
    }

    /**
     * One family of widgets. The concrete products only differ in how they describe themselves,
     * so a family is a set of strings.
     */
    private abstract static class StyledFactory implements ThemeFactory {
        private final PrintStream out;
        private final String button;
        private final String click;
        private final String textBox;
        private final String window;

        StyledFactory(PrintStream out, String button, String click, String textBox, String window) {
            this.out = out;
            this.button = button;
            this.click = click;
            this.textBox = textBox;
            this.window = window;
        }

        @Override
        public Button createButton() {
            return new Button() {
                @Override
                public void render() {
                    out.println("  " + button);
                }

                @Override
                public void click() {
                    out.println("  " + click);
                }
            };
        }

        @Override
        public TextBox createTextBox() {
            return new TextBox() {
                @Override
                public void render() {
                    out.println("  " + textBox);
                }

                @Override
                public void setText(String text) {
                    out.println("  Text set: " + text);
                }
            };
        }

        @Override
        public Window createWindow() {
            return () -> out.println("  " + window);
        }
    }

    static final class WindowsThemeFactory extends StyledFactory {
        WindowsThemeFactory(PrintStream out) {
            super(out,
                    "Rendered Windows-style button with blue theme",
                    "Windows button clicked with system sound",
                    "Rendered Windows-style text box with Segoe UI font",
                    "Rendered Windows-style window with title bar and system controls");
        }
    }

    static final class MacThemeFactory extends StyledFactory {
        MacThemeFactory(PrintStream out) {
            super(out,
                    "Rendered macOS-style button with rounded corners and subtle shadow",
                    "macOS button clicked with haptic feedback",
                    "Rendered macOS-style text box with San Francisco font",
                    "Rendered macOS-style window with traffic light controls");
        }
    }

    static final class LinuxThemeFactory extends StyledFactory {
        LinuxThemeFactory(PrintStream out) {
            super(out,
                    "Rendered Linux-style button with GTK theme",
                    "Linux button clicked with customizable action",
                    "Rendered Linux-style text box with Liberation Sans font",
                    "Rendered Linux-style window with customizable window manager");
        }
    }
}
