package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A book collection walked with its own iterator, then with the enhanced for loop through
 * {@link Iterable}.
 */
public class IteratorDemo extends AbstractPatternDemo {

    public IteratorDemo(DemoContext context) {
        super(context, "Iterator", "Provides a way to access elements of a collection sequentially.");
    }

    @Override
    public void demonstrate() {
        out.println("Book Collection Iterator Example");

        BookCollection library = new BookCollection();
        library.add(new Book("Design Patterns", "GoF"));
        library.add(new Book("Clean Code", "Robert Martin"));
        library.add(new Book("Refactoring", "Martin Fowler"));

        out.println("Iterating through books:");
        BookIterator iterator = library.createIterator();
        while (iterator.hasNext()) {
            Book book = iterator.next();
            out.println("  " + book.title() + " by " + book.author());
        }

        out.println();
        out.println("Using the enhanced for loop (Iterable):");
        for (Book book : library) {
            out.println("  " + book.title() + " by " + book.author());
        }
    }

    record Book(String title, String author) {}

    /**
     * Explicit cursor over a snapshot of the collection.
     */
    static final class BookIterator implements Iterator<Book> {
        private final List<Book> books;
        private int position;

        BookIterator(List<Book> books) {
            this.books = books;
        }

        @Override
        public boolean hasNext() {
            return position < books.size();
        }

        @Override
        public Book next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more elements");
            }
            return books.get(position++);
        }
    }

    static final class BookCollection implements Iterable<Book> {
        private final List<Book> books = new ArrayList<>();

        void add(Book book) {
            books.add(book);
        }

        BookIterator createIterator() {
            return new BookIterator(List.copyOf(books));
        }

        @Override
        public Iterator<Book> iterator() {
            return createIterator();
        }
    }
}
