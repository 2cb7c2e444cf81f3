package org.javai.gof.patterns.behavioral;

import org.javai.gof.patterns.behavioral.VisitorDemo.AreaCalculator;
import org.javai.gof.patterns.behavioral.VisitorDemo.Circle;
import org.javai.gof.patterns.behavioral.VisitorDemo.PerimeterCalculator;
import org.javai.gof.patterns.behavioral.VisitorDemo.Rectangle;
import org.javai.gof.patterns.behavioral.VisitorDemo.Shape;
import org.javai.gof.patterns.behavioral.VisitorDemo.ShapeVisitor;
import org.javai.gof.patterns.behavioral.VisitorDemo.Triangle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class VisitorDemoTest {

    @Test
    void areaAndPerimeter_perShape() {
        AreaCalculator area = new AreaCalculator();
        PerimeterCalculator perimeter = new PerimeterCalculator();

        assertThat(new Rectangle(4, 6).accept(area)).isEqualTo(24.0);
        assertThat(new Rectangle(4, 6).accept(perimeter)).isEqualTo(20.0);
        assertThat(new Triangle(3, 4).accept(area)).isEqualTo(6.0);
        assertThat(new Triangle(3, 4).accept(perimeter)).isEqualTo(12.0);
        assertThat(new Circle(1).accept(area)).isCloseTo(Math.PI, within(1e-9));
        assertThat(new Circle(1).accept(perimeter)).isCloseTo(2 * Math.PI, within(1e-9));
    }

    @Test
    void newOperation_needsNoShapeChanges() {
        ShapeVisitor<String> describer = new ShapeVisitor<>() {
            @Override
            public String visitCircle(Circle circle) {
                return "circle r=" + circle.radius();
            }

            @Override
            public String visitRectangle(Rectangle rectangle) {
                return "rect " + rectangle.width() + "x" + rectangle.height();
            }

            @Override
            public String visitTriangle(Triangle triangle) {
                return "triangle";
            }
        };
        Shape shape = new Rectangle(2, 3);

        assertThat(shape.accept(describer)).isEqualTo("rect 2.0x3.0");
    }
}
