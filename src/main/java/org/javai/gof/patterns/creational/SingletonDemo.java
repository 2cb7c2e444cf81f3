package org.javai.gof.patterns.creational;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Three ways to hold a process-wide instance in Java: an enum constant, the holder idiom, and
 * double-checked locking. The last section shows the alternative of passing one explicitly
 * created object to whoever needs it.
 */
public class SingletonDemo extends AbstractPatternDemo {

    public SingletonDemo(DemoContext context) {
        super(context, "Singleton",
                "Ensures a class has only one instance and provides global access to it. "
                        + "Useful for logging, configuration, database connections, and other resources "
                        + "that should have only one instance throughout the application lifecycle.");
    }

    @Override
    public void demonstrate() {
        out.println("Singleton Pattern Example");
        out.println();

        out.println("1. Enum singleton (configuration):");
        ConfigurationManager config = ConfigurationManager.INSTANCE;
        config.set("app.name", "Design Patterns Demo");
        config.set("app.version", "1.0");
        out.println("  Same instance: " + (config == ConfigurationManager.INSTANCE));
        out.println("  app.name = " + ConfigurationManager.INSTANCE.get("app.name"));
        out.println();

        out.println("2. Holder idiom (logger):");
        AppLogger first = AppLogger.getInstance();
        AppLogger second = AppLogger.getInstance();
        // the logger outlives this run; count only what this run adds
        int before = first.entries().size();
        first.log("Application started");
        second.log("Processing request");
        out.println("  Same instance: " + (first == second));
        out.println("  Entries logged through either reference: " + (second.entries().size() - before));
        out.println();

        out.println("3. Double-checked locking (cache):");
        CacheManager cache = CacheManager.getInstance();
        for (int i = 0; i < 4; i++) {
            CacheManager.getInstance().put("request-" + i, "cached");
        }
        out.println("  Same instance on every call: " + (cache == CacheManager.getInstance()));
        out.println("  Entries cached through getInstance(): " + cache.size());
        out.println("  Cache instances created: " + CacheManager.instancesCreated());
        out.println();

        out.println("4. Explicit application context:");
        ApplicationContext appContext = new ApplicationContext("demo-session");
        OrderService orders = new OrderService(appContext);
        InvoiceService invoices = new InvoiceService(appContext);
        orders.placeOrder();
        invoices.sendInvoice();
        out.println("  Both services share context '" + appContext.name()
                + "' with " + appContext.eventCount() + " events, without any global state.");
    }

    enum ConfigurationManager {
        INSTANCE;

        private final Map<String, String> settings = new ConcurrentHashMap<>();

        void set(String key, String value) {
            settings.put(key, value);
        }

        String get(String key) {
            return settings.get(key);
        }
    }

    static final class AppLogger {
        private final List<String> entries = Collections.synchronizedList(new ArrayList<>());

        private AppLogger() {}

        private static final class Holder {
            private static final AppLogger INSTANCE = new AppLogger();
        }

        static AppLogger getInstance() {
            return Holder.INSTANCE;
        }

        void log(String message) {
            entries.add(message);
        }

        List<String> entries() {
            return entries;
        }
    }

    static final class CacheManager {
        private static final AtomicInteger CREATED = new AtomicInteger();
        private static volatile CacheManager instance;

        private final Map<String, String> cache = new ConcurrentHashMap<>();

        private CacheManager() {
            CREATED.incrementAndGet();
        }

        static CacheManager getInstance() {
            CacheManager result = instance;
            if (result == null) {
                synchronized (CacheManager.class) {
                    result = instance;
                    if (result == null) {
                        instance = result = new CacheManager();
                    }
                }
            }
            return result;
        }

        static int instancesCreated() {
            return CREATED.get();
        }

        void put(String key, String value) {
            cache.put(key, value);
        }

        int size() {
            return cache.size();
        }
    }

    static final class ApplicationContext {
        private final String name;
        private final AtomicInteger events = new AtomicInteger();

        ApplicationContext(String name) {
            this.name = name;
        }

        String name() {
            return name;
        }

        void record() {
            events.incrementAndGet();
        }

        int eventCount() {
            return events.get();
        }
    }

    private final class OrderService {
        private final ApplicationContext appContext;

        OrderService(ApplicationContext appContext) {
            this.appContext = appContext;
        }

        void placeOrder() {
            appContext.record();
            out.println("  OrderService placed an order in " + appContext.name());
        }
    }

    private final class InvoiceService {
        private final ApplicationContext appContext;

        InvoiceService(ApplicationContext appContext) {
            this.appContext = appContext;
        }

        void sendInvoice() {
            appContext.record();
            out.println("  InvoiceService sent an invoice in " + appContext.name());
        }
    }
}
