package org.javai.gof.patterns.behavioral;

import org.javai.gof.patterns.behavioral.ChainOfResponsibilityDemo.Level1Support;
import org.javai.gof.patterns.behavioral.ChainOfResponsibilityDemo.SupportHandler;
import org.javai.gof.patterns.behavioral.ChainOfResponsibilityDemo.SupportTicket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ChainOfResponsibilityDemoTest {

    private final SupportHandler chain = ChainOfResponsibilityDemo.standardChain();

    @Test
    void handle_routesByPriority() {
        assertThat(chain.handle(new SupportTicket("Password reset", 1)))
                .contains("Level 1 Support: Handling basic issue");
        assertThat(chain.handle(new SupportTicket("App bug", 2)))
                .contains("Level 2 Support: Handling technical issue");
        assertThat(chain.handle(new SupportTicket("Server crash", 3)))
                .contains("Level 3 Support: Handling critical issue");
    }

    @Test
    void handle_priorityOutsideLevels_goesToNearestEnd() {
        assertThat(chain.handle(new SupportTicket("Typo", 0))).contains("Level 1 Support: Handling basic issue");
        assertThat(chain.handle(new SupportTicket("Outage", 9))).contains("Level 3 Support: Handling critical issue");
    }

    @Test
    void handle_endOfChainWithoutTaker_isEmpty() {
        SupportHandler shortChain = new Level1Support();

        assertThat(shortChain.handle(new SupportTicket("Fire", 3))).isEmpty();
    }
}
