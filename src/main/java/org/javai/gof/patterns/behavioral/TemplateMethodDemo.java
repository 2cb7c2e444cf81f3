package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;

/**
 * Tea and coffee share one recipe; only brewing and condiments differ.
 */
public class TemplateMethodDemo extends AbstractPatternDemo {

    public TemplateMethodDemo(DemoContext context) {
        super(context, "Template Method",
                "Defines the skeleton of an algorithm, letting subclasses override specific steps.");
    }

    @Override
    public void demonstrate() {
        out.println("Beverage Template Method Example");

        out.println("Making tea:");
        new Tea(out).prepareRecipe();

        out.println();
        out.println("Making coffee:");
        new Coffee(out).prepareRecipe();
    }

    abstract static class Beverage {
        protected final PrintStream out;

        Beverage(PrintStream out) {
            this.out = out;
        }

        final void prepareRecipe() {
            boilWater();
            brew();
            pourInCup();
            addCondiments();
        }

        private void boilWater() {
            out.println("  Boiling water");
        }

        private void pourInCup() {
            out.println("  Pouring into cup");
        }

        protected abstract void brew();

        protected abstract void addCondiments();
    }

    static final class Tea extends Beverage {
        Tea(PrintStream out) {
            super(out);
        }

        @Override
        protected void brew() {
            out.println("  Steeping the tea");
        }

        @Override
        protected void addCondiments() {
            out.println("  Adding lemon");
        }
    }

    static final class Coffee extends Beverage {
        Coffee(PrintStream out) {
            super(out);
        }

        @Override
        protected void brew() {
            out.println("  Dripping coffee through filter");
        }

        @Override
        protected void addCondiments() {
            out.println("  Adding sugar and milk");
        }
    }
}
