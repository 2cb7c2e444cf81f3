package org.javai.gof.patterns.structural;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A folder tree where files and folders answer the same questions (size, display).
 */
public class CompositeDemo extends AbstractPatternDemo {

    public CompositeDemo(DemoContext context) {
        super(context, "Composite",
                "Composes objects into tree structures to represent part-whole hierarchies.");
    }

    @Override
    public void demonstrate() {
        out.println("File System Composite Example");

        Folder root = new Folder("Root");
        Folder docs = new Folder("Documents");
        Folder pics = new Folder("Pictures");

        root.add(docs);
        root.add(pics);
        root.add(new File("readme.txt", 5));

        docs.add(new File("report.pdf", 100));
        docs.add(new File("presentation.pptx", 200));

        pics.add(new File("photo1.jpg", 50));
        pics.add(new File("photo2.png", 75));

        out.println("Total size: " + root.size() + " KB");
        root.display(out, 0);
    }

    abstract static class FileSystemItem {
        protected final String name;

        FileSystemItem(String name) {
            this.name = name;
        }

        abstract int size();

        abstract void display(PrintStream out, int depth);

        static String indent(int depth) {
            return "  ".repeat(depth);
        }
    }

    static final class File extends FileSystemItem {
        private final int size;

        File(String name, int size) {
            super(name);
            this.size = size;
        }

        @Override
        int size() {
            return size;
        }

        @Override
        void display(PrintStream out, int depth) {
            out.println(indent(depth) + "- " + name + " (" + size + " KB)");
        }
    }

    static final class Folder extends FileSystemItem {
        private final List<FileSystemItem> items = new ArrayList<>();

        Folder(String name) {
            super(name);
        }

        void add(FileSystemItem item) {
            items.add(item);
        }

        void remove(FileSystemItem item) {
            items.remove(item);
        }

        @Override
        int size() {
            return items.stream().mapToInt(FileSystemItem::size).sum();
        }

        @Override
        void display(PrintStream out, int depth) {
            out.println(indent(depth) + "+ " + name + "/");
            for (FileSystemItem item : items) {
                item.display(out, depth + 1);
            }
        }
    }
}
