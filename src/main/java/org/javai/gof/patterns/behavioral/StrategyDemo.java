package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Interchangeable algorithms behind one context each: shipping cost, payment method and
 * sorting.
 */
public class StrategyDemo extends AbstractPatternDemo {

    public StrategyDemo(DemoContext context) {
        super(context, "Strategy",
                "Defines a family of algorithms, encapsulates each one, and makes them interchangeable. "
                        + "Useful when you have multiple ways to perform a task and want to choose the algorithm "
                        + "at runtime based on context or configuration.");
    }

    @Override
    public void demonstrate() {
        out.println("Shipping Cost Calculation Strategy Example");
        out.println();

        demonstrateShipping();
        out.println();
        demonstratePayments();
        out.println();
        demonstrateSorting();
    }

    private void demonstrateShipping() {
        out.println("Shipping Cost Strategies:");
        Parcel parcel = new Parcel(new BigDecimal("5.5"), new Dimensions(12, 8, 6),
                "New York, NY", "Los Angeles, CA", true);
        out.println("  Parcel: " + parcel.weight() + " lb, " + parcel.dimensions().volume() + " cu in, "
                + parcel.origin() + " -> " + parcel.destination() + (parcel.fragile() ? ", fragile" : ""));
        out.println();

        ShippingCalculator calculator = new ShippingCalculator();
        for (ShippingStrategy strategy : Tariff.ALL) {
            calculator.setStrategy(strategy);
            out.println("  " + strategy.name() + ": " + strategy.description());
            out.println("     Cost: $" + calculator.cost(parcel));
            out.println("     Delivery: " + calculator.deliveryTime());
            out.println();
        }
    }

    private void demonstratePayments() {
        out.println("Payment Processing Strategies:");
        PaymentContext payments = new PaymentContext();
        BigDecimal amount = new BigDecimal("250.00");

        List<PaymentStrategy> strategies = List.of(
                new CreditCardPayment("1234-5678-9012-3456", "John Doe", "123"),
                new PayPalPayment("john.doe@email.com"),
                new BankTransferPayment("123456789", "987654321"),
                new CryptoPayment("1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa"),
                new PayPalPayment("not-an-email"));

        for (PaymentStrategy strategy : strategies) {
            payments.setStrategy(strategy);
            PaymentResult result = payments.pay(amount);
            out.println("  " + strategy.getClass().getSimpleName() + ":");
            out.println("     " + (result.successful() ? "OK " : "FAILED ") + result.message());
            if (result.successful()) {
                out.println("     Reference: " + result.transactionId());
            }
            out.println();
        }
    }

    private void demonstrateSorting() {
        out.println("Data Sorting Strategies:");
        List<Integer> numbers = List.of(64, 34, 25, 12, 22, 11, 90, 5);
        out.println("  Original data: " + numbers);
        out.println();

        DataSorter sorter = new DataSorter();
        for (SortStrategy strategy : List.of(new BubbleSort(), new QuickSort(), new MergeSort())) {
            List<Integer> copy = new ArrayList<>(numbers);
            sorter.setStrategy(strategy);
            long started = System.nanoTime();
            sorter.sort(copy);
            long elapsedMicros = (System.nanoTime() - started) / 1_000;
            out.println("  " + strategy.algorithmName() + ":");
            out.println("     Result: " + copy);
            out.println("     Time: " + elapsedMicros + " us");
            out.println();
        }
    }

    // Shipping

    record Dimensions(int length, int width, int height) {
        int volume() {
            return length * width * height;
        }
    }

    record Parcel(BigDecimal weight, Dimensions dimensions, String origin, String destination, boolean fragile) {}

    interface ShippingStrategy {
        String name();

        String description();

        String deliveryTime();

        BigDecimal cost(Parcel parcel);
    }

    /**
     * A shipping tariff: per-pound and per-cubic-inch rates plus fixed charges.
     */
    record Tariff(
            String name,
            String description,
            String deliveryTime,
            BigDecimal perPound,
            BigDecimal perCubicInch,
            BigDecimal fragileCharge,
            BigDecimal fixedCharges
    ) implements ShippingStrategy {

        static final Tariff STANDARD = new Tariff("Standard",
                "Standard ground shipping with basic tracking", "5-7 business days",
                new BigDecimal("2.50"), new BigDecimal("0.10"), new BigDecimal("5.00"), BigDecimal.ZERO);
        static final Tariff EXPRESS = new Tariff("Express",
                "Express shipping with priority handling and enhanced tracking", "2-3 business days",
                new BigDecimal("5.00"), new BigDecimal("0.15"), new BigDecimal("10.00"), new BigDecimal("15.00"));
        static final Tariff OVERNIGHT = new Tariff("Overnight",
                "Overnight delivery with signature confirmation", "Next business day by 10:30 AM",
                new BigDecimal("8.00"), new BigDecimal("0.25"), new BigDecimal("20.00"), new BigDecimal("35.00"));
        // customs fee included in the fixed charges
        static final Tariff INTERNATIONAL = new Tariff("International",
                "International shipping with customs handling and insurance", "7-14 business days (customs dependent)",
                new BigDecimal("12.00"), new BigDecimal("0.30"), new BigDecimal("25.00"), new BigDecimal("65.00"));

        static final List<ShippingStrategy> ALL = List.of(STANDARD, EXPRESS, OVERNIGHT, INTERNATIONAL);

        @Override
        public BigDecimal cost(Parcel parcel) {
            BigDecimal cost = parcel.weight().multiply(perPound)
                    .add(BigDecimal.valueOf(parcel.dimensions().volume()).multiply(perCubicInch))
                    .add(fixedCharges);
            if (parcel.fragile()) {
                cost = cost.add(fragileCharge);
            }
            return cost.setScale(2, RoundingMode.HALF_UP);
        }
    }

    static final class ShippingCalculator {
        private ShippingStrategy strategy;

        void setStrategy(ShippingStrategy strategy) {
            this.strategy = strategy;
        }

        BigDecimal cost(Parcel parcel) {
            return requireStrategy().cost(parcel);
        }

        String deliveryTime() {
            return requireStrategy().deliveryTime();
        }

        private ShippingStrategy requireStrategy() {
            if (strategy == null) {
                throw new IllegalStateException("Shipping strategy not set");
            }
            return strategy;
        }
    }

    // Payment

    record PaymentResult(boolean successful, String message, String transactionId) {
        static PaymentResult failed(String message) {
            return new PaymentResult(false, message, "");
        }
    }

    interface PaymentStrategy {
        boolean validate();

        PaymentResult pay(BigDecimal amount);
    }

    static final class PaymentContext {
        private PaymentStrategy strategy;

        void setStrategy(PaymentStrategy strategy) {
            this.strategy = strategy;
        }

        PaymentResult pay(BigDecimal amount) {
            if (strategy == null) {
                return PaymentResult.failed("No payment strategy set");
            }
            if (!strategy.validate()) {
                return PaymentResult.failed("Invalid payment details");
            }
            return strategy.pay(amount);
        }
    }

    static final class CreditCardPayment implements PaymentStrategy {
        private final String cardNumber;
        private final String cardHolder;
        private final String cvv;

        CreditCardPayment(String cardNumber, String cardHolder, String cvv) {
            this.cardNumber = cardNumber;
            this.cardHolder = cardHolder;
            this.cvv = cvv;
        }

        @Override
        public boolean validate() {
            return !isBlank(cardNumber) && !isBlank(cardHolder) && !isBlank(cvv);
        }

        @Override
        public PaymentResult pay(BigDecimal amount) {
            String last4 = cardNumber.substring(cardNumber.length() - 4);
            return new PaymentResult(true,
                    "Credit card payment of $" + amount + " processed successfully (card ending " + last4 + ")",
                    "CC" + ThreadLocalRandom.current().nextInt(1000, 10000));
        }
    }

    static final class PayPalPayment implements PaymentStrategy {
        private final String email;

        PayPalPayment(String email) {
            this.email = email;
        }

        @Override
        public boolean validate() {
            return !isBlank(email) && email.contains("@");
        }

        @Override
        public PaymentResult pay(BigDecimal amount) {
            return new PaymentResult(true, "PayPal payment of $" + amount + " processed via " + email,
                    "PP" + ThreadLocalRandom.current().nextInt(100000, 1000000));
        }
    }

    static final class BankTransferPayment implements PaymentStrategy {
        private final String accountNumber;
        private final String routingNumber;

        BankTransferPayment(String accountNumber, String routingNumber) {
            this.accountNumber = accountNumber;
            this.routingNumber = routingNumber;
        }

        @Override
        public boolean validate() {
            return !isBlank(accountNumber) && !isBlank(routingNumber);
        }

        @Override
        public PaymentResult pay(BigDecimal amount) {
            return new PaymentResult(true, "Bank transfer of $" + amount + " initiated",
                    "BT" + ThreadLocalRandom.current().nextInt(1000000, 10000000));
        }
    }

    static final class CryptoPayment implements PaymentStrategy {
        private final String walletAddress;

        CryptoPayment(String walletAddress) {
            this.walletAddress = walletAddress;
        }

        @Override
        public boolean validate() {
            return walletAddress != null && walletAddress.length() >= 26;
        }

        @Override
        public PaymentResult pay(BigDecimal amount) {
            return new PaymentResult(true, "Cryptocurrency payment of $" + amount + " initiated",
                    "0x" + Long.toHexString(ThreadLocalRandom.current().nextLong()).toUpperCase(Locale.ROOT));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Sorting

    interface SortStrategy {
        void sort(List<Integer> data);

        String algorithmName();
    }

    static final class DataSorter {
        private SortStrategy strategy;

        void setStrategy(SortStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy);
        }

        void sort(List<Integer> data) {
            if (strategy == null) {
                throw new IllegalStateException("Sorting strategy not set");
            }
            strategy.sort(data);
        }
    }

    static final class BubbleSort implements SortStrategy {
        @Override
        public void sort(List<Integer> data) {
            for (int end = data.size() - 1; end > 0; end--) {
                boolean swapped = false;
                for (int i = 0; i < end; i++) {
                    if (data.get(i) > data.get(i + 1)) {
                        data.set(i + 1, data.set(i, data.get(i + 1)));
                        swapped = true;
                    }
                }
                if (!swapped) {
                    return;
                }
            }
        }

        @Override
        public String algorithmName() {
            return "Bubble Sort";
        }
    }

    static final class QuickSort implements SortStrategy {
        @Override
        public void sort(List<Integer> data) {
            quickSort(data, 0, data.size() - 1);
        }

        private static void quickSort(List<Integer> data, int low, int high) {
            if (low >= high) {
                return;
            }
            int pivot = data.get(high);
            int store = low;
            for (int i = low; i < high; i++) {
                if (data.get(i) < pivot) {
                    data.set(store, data.set(i, data.get(store)));
                    store++;
                }
            }
            data.set(high, data.set(store, data.get(high)));
            quickSort(data, low, store - 1);
            quickSort(data, store + 1, high);
        }

        @Override
        public String algorithmName() {
            return "Quick Sort";
        }
    }

    static final class MergeSort implements SortStrategy {
        @Override
        public void sort(List<Integer> data) {
            List<Integer> sorted = mergeSort(new ArrayList<>(data));
            for (int i = 0; i < sorted.size(); i++) {
                data.set(i, sorted.get(i));
            }
        }

        private static List<Integer> mergeSort(List<Integer> data) {
            if (data.size() <= 1) {
                return data;
            }
            int middle = data.size() / 2;
            List<Integer> left = mergeSort(new ArrayList<>(data.subList(0, middle)));
            List<Integer> right = mergeSort(new ArrayList<>(data.subList(middle, data.size())));
            List<Integer> merged = new ArrayList<>(data.size());
            int l = 0;
            int r = 0;
            while (l < left.size() && r < right.size()) {
                merged.add(left.get(l) <= right.get(r) ? left.get(l++) : right.get(r++));
            }
            merged.addAll(left.subList(l, left.size()));
            merged.addAll(right.subList(r, right.size()));
            return merged;
        }

        @Override
        public String algorithmName() {
            return "Merge Sort";
        }
    }
}
