package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.math.BigDecimal;

/**
 * Coffee orders priced by stacking add-on decorators, and text wrapped in formatting
 * decorators.
 */
public class DecoratorDemo extends AbstractPatternDemo {

    public DecoratorDemo(DemoContext context) {
        super(context, "Decorator",
                "Allows behavior to be added to objects dynamically without altering their structure. "
                        + "Useful for extending functionality of objects in a flexible and composable way, "
                        + "especially when you need multiple combinations of features.");
    }

    @Override
    public void demonstrate() {
        out.println("Coffee Shop Decorator Pattern Example");
        out.println();

        out.println("Basic Coffee Orders:");
        displayOrder(new SimpleCoffee(), "Order");
        displayOrder(new MilkDecorator(new SimpleCoffee()), "Order");
        displayOrder(new SugarDecorator(new SimpleCoffee()), "Order");
        displayOrder(new WhippedCreamDecorator(new SimpleCoffee()), "Order");
        out.println();

        out.println("Complex Coffee Orders (Multiple Decorators):");
        displayOrder(new SugarDecorator(new MilkDecorator(new Espresso())), "Latte");
        displayOrder(new WhippedCreamDecorator(new MilkDecorator(new Espresso())), "Cappuccino");
        displayOrder(new VanillaDecorator(
                new WhippedCreamDecorator(
                        new CaramelDecorator(
                                new SugarDecorator(
                                        new MilkDecorator(new Espresso()))))), "Luxury Coffee");

        out.println("  Building custom order step by step:");
        Coffee custom = new DarkRoast();
        step(1, "Base", custom);
        custom = new MilkDecorator(custom);
        step(2, "+Milk", custom);
        custom = new SugarDecorator(custom);
        step(3, "+Sugar", custom);
        custom = new CaramelDecorator(custom);
        step(4, "+Caramel", custom);
        displayOrder(custom, "Final Custom Order");
        out.println();

        out.println("Text Formatting Decorator Example:");
        out.println("  " + new PlainText("Hello, World!").render());
        out.println("  " + new BoldDecorator(new PlainText("Important Message")).render());
        out.println("  " + new ItalicDecorator(new PlainText("Emphasized Text")).render());
        out.println("  " + new UnderlineDecorator(
                new BoldDecorator(
                        new ItalicDecorator(new PlainText("Fully Formatted Text")))).render());
        out.println("  " + new ColorDecorator(
                new BoldDecorator(new PlainText("Colorized Bold Text")), "Red").render());
    }

    private void step(int number, String label, Coffee coffee) {
        out.println("     " + number + ". " + label + ": " + coffee.description() + " - $" + coffee.cost());
    }

    private void displayOrder(Coffee coffee, String orderName) {
        out.println("  " + orderName + ":");
        out.println("     " + coffee.description());
        out.println("     Total: $" + coffee.cost());
        out.println();
    }

    interface Coffee {
        String description();

        BigDecimal cost();
    }

    interface TextComponent {
        String render();
    }

    static final class SimpleCoffee implements Coffee {
        @Override
        public String description() {
            return "Simple Coffee";
        }

        @Override
        public BigDecimal cost() {
            return new BigDecimal("2.00");
        }
    }

    static final class Espresso implements Coffee {
        @Override
        public String description() {
            return "Espresso";
        }

        @Override
        public BigDecimal cost() {
            return new BigDecimal("3.50");
        }
    }

    static final class DarkRoast implements Coffee {
        @Override
        public String description() {
            return "Dark Roast Coffee";
        }

        @Override
        public BigDecimal cost() {
            return new BigDecimal("2.75");
        }
    }

    /**
     * Adds one named ingredient and its price to the wrapped coffee.
     */
    abstract static class CoffeeDecorator implements Coffee {
        private final Coffee coffee;
        private final String ingredient;
        private final BigDecimal price;

        CoffeeDecorator(Coffee coffee, String ingredient, String price) {
            this.coffee = coffee;
            this.ingredient = ingredient;
            this.price = new BigDecimal(price);
        }

        @Override
        public String description() {
            return coffee.description() + ", " + ingredient;
        }

        @Override
        public BigDecimal cost() {
            return coffee.cost().add(price);
        }
    }

    static final class MilkDecorator extends CoffeeDecorator {
        MilkDecorator(Coffee coffee) {
            super(coffee, "Milk", "0.50");
        }
    }

    static final class SugarDecorator extends CoffeeDecorator {
        SugarDecorator(Coffee coffee) {
            super(coffee, "Sugar", "0.25");
        }
    }

    static final class WhippedCreamDecorator extends CoffeeDecorator {
        WhippedCreamDecorator(Coffee coffee) {
            super(coffee, "Whipped Cream", "0.75");
        }
    }

    static final class VanillaDecorator extends CoffeeDecorator {
        VanillaDecorator(Coffee coffee) {
            super(coffee, "Vanilla", "0.60");
        }
    }

    static final class CaramelDecorator extends CoffeeDecorator {
        CaramelDecorator(Coffee coffee) {
            super(coffee, "Caramel", "0.80");
        }
    }

    record PlainText(String text) implements TextComponent {
        @Override
        public String render() {
            return text;
        }
    }

    record BoldDecorator(TextComponent inner) implements TextComponent {
        @Override
        public String render() {
            return "<b>" + inner.render() + "</b>";
        }
    }

    record ItalicDecorator(TextComponent inner) implements TextComponent {
        @Override
        public String render() {
            return "<i>" + inner.render() + "</i>";
        }
    }

    record UnderlineDecorator(TextComponent inner) implements TextComponent {
        @Override
        public String render() {
            return "<u>" + inner.render() + "</u>";
        }
    }

    record ColorDecorator(TextComponent inner, String color) implements TextComponent {
        @Override
        public String render() {
            return "<span style=\"color: " + color + "\">" + inner.render() + "</span>";
        }
    }
}
