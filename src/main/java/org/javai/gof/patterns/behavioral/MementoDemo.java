package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A text editor whose saved states are kept by a separate history and restored on undo.
 */
public class MementoDemo extends AbstractPatternDemo {

    public MementoDemo(DemoContext context) {
        super(context, "Memento",
                "Captures and restores an object's internal state without violating encapsulation.");
    }

    @Override
    public void demonstrate() {
        out.println("Text Editor Memento Example");

        TextEditor editor = new TextEditor();
        EditorHistory history = new EditorHistory();

        editor.write("Hello");
        history.save(editor);
        showContent(editor);

        editor.write(" World");
        history.save(editor);
        showContent(editor);

        editor.write("!!!");
        showContent(editor);

        out.println();
        out.println("Undoing last change:");
        history.undo(editor);
        showContent(editor);

        out.println();
        out.println("Undoing again:");
        history.undo(editor);
        showContent(editor);

        out.println();
        out.println("Undoing with an empty history:");
        if (!history.undo(editor)) {
            out.println("No more states to restore");
        }
        showContent(editor);
    }

    private void showContent(TextEditor editor) {
        out.println("Current: '" + editor.content() + "'");
    }

    /**
     * Opaque snapshot; only the editor reads it.
     */
    static final class EditorMemento {
        private final String content;

        private EditorMemento(String content) {
            this.content = content;
        }
    }

    static final class TextEditor {
        private final StringBuilder content = new StringBuilder();

        void write(String text) {
            content.append(text);
        }

        String content() {
            return content.toString();
        }

        EditorMemento save() {
            return new EditorMemento(content.toString());
        }

        void restore(EditorMemento memento) {
            content.setLength(0);
            content.append(memento.content);
        }
    }

    static final class EditorHistory {
        private final Deque<EditorMemento> history = new ArrayDeque<>();

        void save(TextEditor editor) {
            history.push(editor.save());
        }

        /**
         * Restores the most recent snapshot. Returns false when there is none.
         */
        boolean undo(TextEditor editor) {
            EditorMemento memento = history.poll();
            if (memento == null) {
                return false;
            }
            editor.restore(memento);
            return true;
        }
    }
}
