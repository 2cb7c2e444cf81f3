package org.javai.gof.patterns.behavioral;

import org.javai.gof.patterns.behavioral.IteratorDemo.Book;
import org.javai.gof.patterns.behavioral.IteratorDemo.BookCollection;
import org.javai.gof.patterns.behavioral.IteratorDemo.BookIterator;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class IteratorDemoTest {

    @Test
    void iterator_visitsBooksInInsertionOrder() {
        BookCollection books = new BookCollection();
        Book first = new Book("Design Patterns", "Gang of Four");
        Book second = new Book("Refactoring", "Martin Fowler");
        books.add(first);
        books.add(second);

        assertThat(books).containsExactly(first, second);
    }

    @Test
    void iterator_exhausted_throws() {
        BookCollection books = new BookCollection();
        books.add(new Book("Clean Code", "Robert C. Martin"));
        BookIterator iterator = books.createIterator();

        iterator.next();

        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void iterator_isNotAffectedByLaterAdds() {
        BookCollection books = new BookCollection();
        books.add(new Book("A", "a"));
        BookIterator iterator = books.createIterator();

        books.add(new Book("B", "b"));

        iterator.next();
        assertThat(iterator.hasNext()).isFalse();
    }
}
