package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Chat users never reference each other; the room relays every message.
 */
public class MediatorDemo extends AbstractPatternDemo {

    public MediatorDemo(DemoContext context) {
        super(context, "Mediator", "Defines how objects interact with each other through a mediator.");
    }

    @Override
    public void demonstrate() {
        out.println("Chat Room Mediator Example");

        ChatRoom chatRoom = new ChatRoom(out);
        User alice = new User("Alice", chatRoom, out);
        User bob = new User("Bob", chatRoom, out);
        User charlie = new User("Charlie", chatRoom, out);

        alice.send("Hello everyone!");
        bob.send("Hi Alice!");
        charlie.send("Hey there!");
    }

    interface ChatMediator {
        void addUser(User user);

        void sendMessage(String message, User sender);
    }

    static final class ChatRoom implements ChatMediator {
        private final PrintStream out;
        private final List<User> users = new ArrayList<>();

        ChatRoom(PrintStream out) {
            this.out = out;
        }

        @Override
        public void addUser(User user) {
            users.add(user);
            out.println(user.name() + " joined the chat");
        }

        @Override
        public void sendMessage(String message, User sender) {
            for (User user : users) {
                if (user != sender) {
                    user.receive(message, sender.name());
                }
            }
        }
    }

    static final class User {
        private final String name;
        private final ChatMediator mediator;
        private final PrintStream out;
        private final List<String> inbox = new ArrayList<>();

        User(String name, ChatMediator mediator, PrintStream out) {
            this.name = name;
            this.mediator = mediator;
            this.out = out;
            mediator.addUser(this);
        }

        String name() {
            return name;
        }

        List<String> inbox() {
            return inbox;
        }

        void send(String message) {
            out.println(name + ": " + message);
            mediator.sendMessage(message, this);
        }

        void receive(String message, String from) {
            inbox.add(from + ": " + message);
            out.println("  " + name + " received from " + from + ": " + message);
        }
    }
}
