package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.List;

/**
 * Image proxies that defer the expensive load until an image is first displayed.
 */
public class ProxyDemo extends AbstractPatternDemo {

    public ProxyDemo(DemoContext context) {
        super(context, "Proxy",
                "Provides a placeholder or surrogate to control access to another object.");
    }

    @Override
    public void demonstrate() throws InterruptedException {
        out.println("Image Proxy Example");

        List<Image> images = List.of(
                new ImageProxy("photo1.jpg", this::loadFromDisk),
                new ImageProxy("photo2.jpg", this::loadFromDisk),
                new ImageProxy("photo3.jpg", this::loadFromDisk));

        out.println("Images created (not loaded yet)");

        out.println();
        out.println("Displaying first image:");
        images.get(0).display();

        out.println();
        out.println("Displaying first image again (cached):");
        images.get(0).display();

        out.println();
        out.println("Displaying second image:");
        images.get(1).display();
    }

    private RealImage loadFromDisk(String filename) throws InterruptedException {
        out.println("  Loading " + filename + " from disk...");
        // simulated disk latency
        context.pause(2);
        return new RealImage(filename);
    }

    interface Image {
        void display() throws InterruptedException;
    }

    @FunctionalInterface
    interface ImageLoader {
        RealImage load(String filename) throws InterruptedException;
    }

    final class RealImage implements Image {
        private final String filename;

        RealImage(String filename) {
            this.filename = filename;
        }

        @Override
        public void display() {
            out.println("  Displaying " + filename);
        }
    }

    static final class ImageProxy implements Image {
        private final String filename;
        private final ImageLoader loader;
        private RealImage realImage;

        ImageProxy(String filename, ImageLoader loader) {
            this.filename = filename;
            this.loader = loader;
        }

        boolean isLoaded() {
            return realImage != null;
        }

        @Override
        public void display() throws InterruptedException {
            if (realImage == null) {
                realImage = loader.load(filename);
            }
            realImage.display();
        }
    }
}
