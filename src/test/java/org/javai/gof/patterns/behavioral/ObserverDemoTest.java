package org.javai.gof.patterns.behavioral;

import org.javai.gof.patterns.behavioral.ObserverDemo.NewsAgency;
import org.javai.gof.patterns.behavioral.ObserverDemo.NewsObserver;
import org.javai.gof.patterns.behavioral.ObserverDemo.Stock;
import org.javai.gof.patterns.behavioral.ObserverDemo.StockObserver;
import org.javai.gof.patterns.behavioral.ObserverDemo.TradingBot;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ObserverDemoTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);

    @Test
    void updatePrice_notifiesEverySubscriber() {
        Stock stock = new Stock(out, "AAPL", "Apple Inc.", new BigDecimal("150.00"));
        List<String> seen = new ArrayList<>();
        StockObserver first = (s, oldPrice, newPrice) -> seen.add("first " + newPrice);
        StockObserver second = (s, oldPrice, newPrice) -> seen.add("second " + oldPrice);
        stock.subscribe(first);
        stock.subscribe(second);
        stock.subscribe(first);

        int notified = stock.updatePrice(new BigDecimal("155.25"));

        assertThat(notified).isEqualTo(2);
        assertThat(seen).containsExactly("first 155.25", "second 150.00");
        assertThat(stock.price()).isEqualByComparingTo("155.25");
    }

    @Test
    void updatePrice_belowOneCent_isIgnored() {
        Stock stock = new Stock(out, "AAPL", "Apple Inc.", new BigDecimal("150.00"));
        List<BigDecimal> seen = new ArrayList<>();
        stock.subscribe((s, oldPrice, newPrice) -> seen.add(newPrice));

        assertThat(stock.updatePrice(new BigDecimal("150.005"))).isZero();
        assertThat(seen).isEmpty();
        assertThat(stock.price()).isEqualByComparingTo("150.00");
    }

    @Test
    void unsubscribedObserver_isNotNotified() {
        Stock stock = new Stock(out, "MSFT", "Microsoft", new BigDecimal("300.00"));
        List<BigDecimal> seen = new ArrayList<>();
        StockObserver observer = (s, oldPrice, newPrice) -> seen.add(newPrice);
        stock.subscribe(observer);
        stock.unsubscribe(observer);

        assertThat(stock.updatePrice(new BigDecimal("310.00"))).isZero();
        assertThat(seen).isEmpty();
    }

    @Test
    void failingObserver_doesNotStopOthers() {
        Stock stock = new Stock(out, "TSLA", "Tesla", new BigDecimal("200.00"));
        List<BigDecimal> seen = new ArrayList<>();
        stock.subscribe((s, oldPrice, newPrice) -> {
            throw new IllegalStateException("feed offline");
        });
        stock.subscribe((s, oldPrice, newPrice) -> seen.add(newPrice));

        assertThat(stock.updatePrice(new BigDecimal("210.00"))).isEqualTo(1);
        assertThat(seen).hasSize(1);
        assertThat(output.toString(StandardCharsets.UTF_8)).contains("Error notifying observer: feed offline");
    }

    @Test
    void tradingBot_decidesOnThresholdCrossings() {
        assertThat(TradingBot.decide(new BigDecimal("150"), new BigDecimal("148"))).isEqualTo("AUTO-BUY");
        assertThat(TradingBot.decide(new BigDecimal("155"), new BigDecimal("161"))).isEqualTo("AUTO-SELL");
        assertThat(TradingBot.decide(new BigDecimal("150"), new BigDecimal("155"))).isEqualTo("HOLD");
        assertThat(TradingBot.decide(new BigDecimal("148"), new BigDecimal("147"))).isEqualTo("HOLD");
    }

    @Test
    void newsAgency_deliversByCategory() {
        NewsAgency agency = new NewsAgency(out, "Global News");
        List<String> tech = new ArrayList<>();
        NewsObserver techDesk = (category, headline) -> tech.add(headline);
        agency.subscribe(techDesk, "Technology");

        assertThat(agency.publish("Technology", "New chip released")).isEqualTo(1);
        assertThat(agency.publish("Sports", "Final tonight")).isZero();
        agency.unsubscribe(techDesk, "Technology");
        assertThat(agency.publish("Technology", "Another chip")).isZero();

        assertThat(tech).containsExactly("New chip released");
    }
}
