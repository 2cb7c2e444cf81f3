package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Support tickets escalated through three support levels until one accepts them.
 */
public class ChainOfResponsibilityDemo extends AbstractPatternDemo {

    public ChainOfResponsibilityDemo(DemoContext context) {
        super(context, "Chain of Responsibility",
                "Passes requests along a chain of handlers until one handles it.");
    }

    @Override
    public void demonstrate() {
        out.println("Support Ticket Chain Example");

        SupportHandler chain = standardChain();

        List<SupportTicket> tickets = List.of(
                new SupportTicket("Password reset", 1),
                new SupportTicket("Server crash", 3),
                new SupportTicket("App bug", 2),
                new SupportTicket("Security breach", 3));

        for (SupportTicket ticket : tickets) {
            process(chain, ticket);
        }

        out.println();
        out.println("A chain without Level 3 cannot place critical tickets:");
        SupportHandler shortChain = new Level1Support();
        shortChain.setNext(new Level2Support());
        process(shortChain, new SupportTicket("Data center fire", 3));
    }

    private void process(SupportHandler chain, SupportTicket ticket) {
        out.println();
        out.println("Processing: " + ticket.issue() + " (Level " + ticket.priority() + ")");
        Optional<String> handledBy = chain.handle(ticket);
        if (handledBy.isPresent()) {
            out.println("  " + handledBy.get());
        } else {
            out.println("  No handler available for this ticket");
        }
    }

    static SupportHandler standardChain() {
        SupportHandler chain = new Level1Support();
        chain.setNext(new Level2Support()).setNext(new Level3Support());
        return chain;
    }

    record SupportTicket(String issue, int priority) {}

    /**
     * A link in the chain. {@link #handle} returns who handled the ticket, or empty when
     * the end of the chain was reached without a taker.
     */
    abstract static class SupportHandler {
        private SupportHandler next;

        SupportHandler setNext(SupportHandler handler) {
            this.next = handler;
            return handler;
        }

        Optional<String> handle(SupportTicket ticket) {
            if (canHandle(ticket)) {
                return Optional.of(describeHandling());
            }
            return next == null ? Optional.empty() : next.handle(ticket);
        }

        abstract boolean canHandle(SupportTicket ticket);

        abstract String describeHandling();
    }

    static final class Level1Support extends SupportHandler {
        @Override
        boolean canHandle(SupportTicket ticket) {
            return ticket.priority() <= 1;
        }

        @Override
        String describeHandling() {
            return "Level 1 Support: Handling basic issue";
        }
    }

    static final class Level2Support extends SupportHandler {
        @Override
        boolean canHandle(SupportTicket ticket) {
            return ticket.priority() == 2;
        }

        @Override
        String describeHandling() {
            return "Level 2 Support: Handling technical issue";
        }
    }

    static final class Level3Support extends SupportHandler {
        @Override
        boolean canHandle(SupportTicket ticket) {
            return ticket.priority() >= 3;
        }

        @Override
        String describeHandling() {
            return "Level 3 Support: Handling critical issue";
        }
    }
}
