package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stock price fanned out to several watchers, then a news agency that notifies subscribers
 * per category.
 */
public class ObserverDemo extends AbstractPatternDemo {

    public ObserverDemo(DemoContext context) {
        super(context, "Observer",
                "Defines a one-to-many dependency between objects so that when one object changes state, "
                        + "all its dependents are notified automatically. Useful for implementing event handling systems, "
                        + "model-view architectures, and publish-subscribe patterns.");
    }

    @Override
    public void demonstrate() {
        out.println("Stock Market Observer Pattern Example");
        out.println();

        demonstrateStockPrices();
        out.println();
        demonstrateNewsPublisher();
    }

    private void demonstrateStockPrices() {
        out.println("Stock Price Monitoring System:");

        Stock apple = new Stock(out, "AAPL", "Apple Inc.", new BigDecimal("150.00"));
        StockObserver mobileApp = new MobileAppNotifier(out, "StockTracker Mobile");
        apple.subscribe(mobileApp);
        apple.subscribe(new EmailNotifier(out, "alerts@stocktracker.com"));
        apple.subscribe(new TradingBot(out, "AutoTrader v2.1"));
        apple.subscribe(new TradingDashboard(out, "Main Dashboard"));

        out.println("Initial stock price: " + apple.symbol() + " = $" + apple.price());
        out.println();

        out.println("Simulating price changes...");
        apple.updatePrice(new BigDecimal("155.25"));
        out.println();
        apple.updatePrice(new BigDecimal("148.75"));
        out.println();

        out.println("Mobile app unsubscribing from notifications...");
        apple.unsubscribe(mobileApp);
        out.println();
        apple.updatePrice(new BigDecimal("160.50"));
        out.println();

        out.println("A change below one cent notifies nobody:");
        int notified = apple.updatePrice(new BigDecimal("160.505"));
        out.println("  Observers notified: " + notified);
    }

    private void demonstrateNewsPublisher() {
        out.println("News Publisher System:");

        NewsAgency agency = new NewsAgency(out, "TechNews Central");
        NewsObserver website = new NewsSubscriber(out, "Website", "TechNews.com");
        NewsObserver newsletter = new NewsSubscriber(out, "Newsletter", "Weekly Tech Digest");
        NewsObserver socialMedia = new NewsSubscriber(out, "Social", "@TechNewsBot");

        agency.subscribe(website, "Technology");
        agency.subscribe(newsletter, "Technology");
        agency.subscribe(socialMedia, "Technology");
        agency.subscribe(website, "Business");

        agency.publish("Technology", "New breakthrough in quantum computing announced!");
        out.println();
        agency.publish("Business", "Tech giants report record quarterly earnings");
        out.println();

        agency.unsubscribe(socialMedia, "Technology");
        agency.publish("Technology", "AI model achieves human-level performance in complex reasoning");
        out.println();
        agency.publish("Sports", "Local team wins the championship");
    }

    interface StockObserver {
        void update(Stock stock, BigDecimal oldPrice, BigDecimal newPrice);
    }

    interface NewsObserver {
        void onNewsPublished(String category, String headline);
    }

    static final class Stock {
        private static final BigDecimal MINIMUM_CHANGE = new BigDecimal("0.01");

        private final PrintStream out;
        private final String symbol;
        private final String companyName;
        private final List<StockObserver> observers = new ArrayList<>();
        private BigDecimal price;

        Stock(PrintStream out, String symbol, String companyName, BigDecimal price) {
            this.out = out;
            this.symbol = symbol;
            this.companyName = companyName;
            this.price = price;
        }

        String symbol() {
            return symbol;
        }

        String companyName() {
            return companyName;
        }

        BigDecimal price() {
            return price;
        }

        void subscribe(StockObserver observer) {
            if (!observers.contains(observer)) {
                observers.add(observer);
                out.println("  Observer subscribed to " + symbol);
            }
        }

        void unsubscribe(StockObserver observer) {
            if (observers.remove(observer)) {
                out.println("  Observer unsubscribed from " + symbol);
            }
        }

        /**
         * Updates the price and notifies observers when it moved by at least one cent.
         *
         * @return the number of observers notified
         */
        int updatePrice(BigDecimal newPrice) {
            if (newPrice.subtract(price).abs().compareTo(MINIMUM_CHANGE) < 0) {
                return 0;
            }
            BigDecimal oldPrice = price;
            price = newPrice;
            return notifyObservers(oldPrice);
        }

        private int notifyObservers(BigDecimal oldPrice) {
            out.println("Notifying " + observers.size() + " observers about " + symbol + " price change...");
            int notified = 0;
            for (StockObserver observer : List.copyOf(observers)) {
                try {
                    observer.update(this, oldPrice, price);
                    notified++;
                } catch (RuntimeException e) {
                    out.println("  Error notifying observer: " + e.getMessage());
                }
            }
            return notified;
        }
    }

    static final class MobileAppNotifier implements StockObserver {
        private final PrintStream out;
        private final String appName;

        MobileAppNotifier(PrintStream out, String appName) {
            this.out = out;
            this.appName = appName;
        }

        @Override
        public void update(Stock stock, BigDecimal oldPrice, BigDecimal newPrice) {
            BigDecimal changePercent = newPrice.subtract(oldPrice)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(oldPrice, 2, RoundingMode.HALF_UP);
            String trend = newPrice.compareTo(oldPrice) > 0 ? "up" : "down";
            out.println("  " + appName + ": " + stock.symbol() + " " + trend + " $" + oldPrice + " -> $" + newPrice
                    + " (" + signed(changePercent) + "%)");
            if (changePercent.abs().compareTo(BigDecimal.valueOf(2)) > 0) {
                out.println("     Push notification sent: " + stock.companyName() + " moved "
                        + signed(changePercent.setScale(1, RoundingMode.HALF_UP)) + "%!");
            }
        }
    }

    static final class EmailNotifier implements StockObserver {
        private final PrintStream out;
        private final String emailAddress;

        EmailNotifier(PrintStream out, String emailAddress) {
            this.out = out;
            this.emailAddress = emailAddress;
        }

        @Override
        public void update(Stock stock, BigDecimal oldPrice, BigDecimal newPrice) {
            out.println("  Email to " + emailAddress + ": " + stock.symbol() + " price alert");
            out.println("     Price changed from $" + oldPrice + " to $" + newPrice);
            if (newPrice.compareTo(BigDecimal.valueOf(150)) < 0) {
                out.println("     LOW PRICE ALERT: Consider buying opportunity!");
            } else if (newPrice.compareTo(BigDecimal.valueOf(160)) > 0) {
                out.println("     HIGH PRICE ALERT: Consider selling opportunity!");
            }
        }
    }

    static final class TradingBot implements StockObserver {
        private static final BigDecimal BUY_THRESHOLD = new BigDecimal("149.00");
        private static final BigDecimal SELL_THRESHOLD = new BigDecimal("160.00");

        private final PrintStream out;
        private final String botName;

        TradingBot(PrintStream out, String botName) {
            this.out = out;
            this.botName = botName;
        }

        @Override
        public void update(Stock stock, BigDecimal oldPrice, BigDecimal newPrice) {
            out.println("  " + botName + ": Analyzing " + stock.symbol() + " price movement...");
            out.println("     " + decide(oldPrice, newPrice) + " at $" + newPrice);
        }

        static String decide(BigDecimal oldPrice, BigDecimal newPrice) {
            if (newPrice.compareTo(BUY_THRESHOLD) <= 0 && oldPrice.compareTo(BUY_THRESHOLD) > 0) {
                return "AUTO-BUY";
            }
            if (newPrice.compareTo(SELL_THRESHOLD) >= 0 && oldPrice.compareTo(SELL_THRESHOLD) < 0) {
                return "AUTO-SELL";
            }
            return "HOLD";
        }
    }

    static final class TradingDashboard implements StockObserver {
        private final PrintStream out;
        private final String dashboardName;

        TradingDashboard(PrintStream out, String dashboardName) {
            this.out = out;
            this.dashboardName = dashboardName;
        }

        @Override
        public void update(Stock stock, BigDecimal oldPrice, BigDecimal newPrice) {
            BigDecimal change = newPrice.subtract(oldPrice);
            int bars = Math.min(10, Math.max(1, newPrice.intValue() / 10));
            out.println("  " + dashboardName + ": Updated " + stock.symbol() + " display");
            out.println("     $" + newPrice + " (" + signed(change) + ")");
            out.println("     Chart: " + "#".repeat(bars) + " $" + newPrice);
        }
    }

    static final class NewsAgency {
        private final PrintStream out;
        private final String name;
        private final Map<String, List<NewsObserver>> subscribers = new LinkedHashMap<>();

        NewsAgency(PrintStream out, String name) {
            this.out = out;
            this.name = name;
        }

        void subscribe(NewsObserver observer, String category) {
            List<NewsObserver> list = subscribers.computeIfAbsent(category, key -> new ArrayList<>());
            if (!list.contains(observer)) {
                list.add(observer);
                out.println("  Observer subscribed to '" + category + "' news");
            }
        }

        void unsubscribe(NewsObserver observer, String category) {
            List<NewsObserver> list = subscribers.get(category);
            if (list != null && list.remove(observer)) {
                out.println("  Observer unsubscribed from '" + category + "' news");
            }
        }

        int publish(String category, String headline) {
            out.println(name + " publishing [" + category + "]: " + headline);
            List<NewsObserver> list = subscribers.getOrDefault(category, List.of());
            if (list.isEmpty()) {
                out.println("  No subscribers for '" + category + "'");
            }
            for (NewsObserver observer : List.copyOf(list)) {
                observer.onNewsPublished(category, headline);
            }
            return list.size();
        }
    }

    static final class NewsSubscriber implements NewsObserver {
        private final PrintStream out;
        private final String channel;
        private final String name;

        NewsSubscriber(PrintStream out, String channel, String name) {
            this.out = out;
            this.channel = channel;
            this.name = name;
        }

        @Override
        public void onNewsPublished(String category, String headline) {
            out.println("  " + channel + " " + name + " received " + category + " story: " + headline);
        }
    }

    private static String signed(BigDecimal value) {
        return (value.signum() >= 0 ? "+" : "") + value.toPlainString();
    }
}
