package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * A forest of a thousand trees that share a handful of {@link TreeType} flyweights. The factory
 * belongs to the forest, so every run starts with an empty cache.
 */
public class FlyweightDemo extends AbstractPatternDemo {

    static final int TREE_COUNT = 1000;
    private static final int SHOWN = 5;

    public FlyweightDemo(DemoContext context) {
        super(context, "Flyweight",
                "Uses sharing to efficiently support large numbers of similar objects.");
    }

    @Override
    public void demonstrate() {
        out.println("Tree Forest Flyweight Example");

        Forest forest = plantForest(new Random());
        forest.paint(out);

        out.println("Created " + forest.treeCount() + " trees");
        out.println("TreeType flyweights created: " + forest.factory().createdTypes());
    }

    static Forest plantForest(Random random) {
        Forest forest = new Forest(new TreeTypeFactory());
        for (int i = 0; i < TREE_COUNT; i++) {
            forest.plantTree(random.nextInt(100), random.nextInt(100), "Oak", "Green", "tree.png");
        }
        return forest;
    }

    /**
     * Intrinsic state shared by every tree of the same kind.
     */
    record TreeType(String name, String color, String sprite) {
        void render(PrintStream out, int x, int y) {
            out.println("  Rendering " + color + " " + name + " at (" + x + ", " + y + ")");
        }
    }

    static final class TreeTypeFactory {
        private final Map<String, TreeType> treeTypes = new HashMap<>();

        TreeType treeType(String name, String color, String sprite) {
            return treeTypes.computeIfAbsent(name + "-" + color + "-" + sprite,
                    key -> new TreeType(name, color, sprite));
        }

        int createdTypes() {
            return treeTypes.size();
        }
    }

    /**
     * Extrinsic state: position only.
     */
    record Tree(int x, int y, TreeType type) {
        void paint(PrintStream out) {
            type.render(out, x, y);
        }
    }

    static final class Forest {
        private final TreeTypeFactory factory;
        private final List<Tree> trees = new ArrayList<>();

        Forest(TreeTypeFactory factory) {
            this.factory = factory;
        }

        void plantTree(int x, int y, String name, String color, String sprite) {
            trees.add(new Tree(x, y, factory.treeType(name, color, sprite)));
        }

        int treeCount() {
            return trees.size();
        }

        TreeTypeFactory factory() {
            return factory;
        }

        List<Tree> trees() {
            return trees;
        }

        void paint(PrintStream out) {
            out.println("Painting forest (showing first " + SHOWN + " trees):");
            trees.stream().limit(SHOWN).forEach(tree -> tree.paint(out));
            if (trees.size() > SHOWN) {
                out.println("... and " + (trees.size() - SHOWN) + " more trees");
            }
        }
    }
}
