package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.List;
import java.util.Locale;

/**
 * Area and perimeter computed by visitors, leaving the shape classes untouched.
 */
public class VisitorDemo extends AbstractPatternDemo {

    public VisitorDemo(DemoContext context) {
        super(context, "Visitor",
                "Defines operations to be performed on elements without changing their classes.");
    }

    @Override
    public void demonstrate() {
        out.println("Shape Visitor Example");

        List<Shape> shapes = List.of(new Circle(5), new Rectangle(4, 6), new Triangle(3, 4));

        out.println("Calculating areas:");
        AreaCalculator area = new AreaCalculator();
        for (Shape shape : shapes) {
            out.println("  " + shape.label() + " area: " + format(shape.accept(area)));
        }

        out.println();
        out.println("Calculating perimeters:");
        PerimeterCalculator perimeter = new PerimeterCalculator();
        for (Shape shape : shapes) {
            out.println("  " + shape.label() + " perimeter: " + format(shape.accept(perimeter)));
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    interface ShapeVisitor<R> {
        R visitCircle(Circle circle);

        R visitRectangle(Rectangle rectangle);

        R visitTriangle(Triangle triangle);
    }

    interface Shape {
        <R> R accept(ShapeVisitor<R> visitor);

        String label();
    }

    record Circle(double radius) implements Shape {
        @Override
        public <R> R accept(ShapeVisitor<R> visitor) {
            return visitor.visitCircle(this);
        }

        @Override
        public String label() {
            return "Circle";
        }
    }

    record Rectangle(double width, double height) implements Shape {
        @Override
        public <R> R accept(ShapeVisitor<R> visitor) {
            return visitor.visitRectangle(this);
        }

        @Override
        public String label() {
            return "Rectangle";
        }
    }

    /**
     * Right triangle with legs {@code base} and {@code height}.
     */
    record Triangle(double base, double height) implements Shape {
        @Override
        public <R> R accept(ShapeVisitor<R> visitor) {
            return visitor.visitTriangle(this);
        }

        @Override
        public String label() {
            return "Triangle";
        }
    }

    static final class AreaCalculator implements ShapeVisitor<Double> {
        @Override
        public Double visitCircle(Circle circle) {
            return Math.PI * circle.radius() * circle.radius();
        }

        @Override
        public Double visitRectangle(Rectangle rectangle) {
            return rectangle.width() * rectangle.height();
        }

        @Override
        public Double visitTriangle(Triangle triangle) {
            return 0.5 * triangle.base() * triangle.height();
        }
    }

    static final class PerimeterCalculator implements ShapeVisitor<Double> {
        @Override
        public Double visitCircle(Circle circle) {
            return 2 * Math.PI * circle.radius();
        }

        @Override
        public Double visitRectangle(Rectangle rectangle) {
            return 2 * (rectangle.width() + rectangle.height());
        }

        @Override
        public Double visitTriangle(Triangle triangle) {
            return triangle.base() + triangle.height() + Math.hypot(triangle.base(), triangle.height());
        }
    }
}
