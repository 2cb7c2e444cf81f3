package org.javai.gof.patterns.structural;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Three third-party payment gateways and three data formats, each wrapped so the application
 * talks to a single interface.
 */
public class AdapterDemo extends AbstractPatternDemo {

    public AdapterDemo(DemoContext context) {
        super(context, "Adapter",
                "Allows incompatible interfaces to work together. "
                        + "Useful when integrating with third-party libraries or legacy systems "
                        + "that have different interfaces than what your application expects.");
    }

    @Override
    public void demonstrate() {
        out.println("Payment Gateway Adapter Example");
        out.println();

        demonstratePaymentProcessing();
        out.println();
        demonstrateDataSources();
    }

    private void demonstratePaymentProcessing() {
        out.println("Processing payments through different gateways:");

        List<PaymentProcessor> processors = List.of(
                new StripePaymentAdapter(new StripeGateway()),
                new PayPalPaymentAdapter(new PayPalApi()),
                new SquarePaymentAdapter(new SquareProcessor()));

        PaymentRequest request = new PaymentRequest(new BigDecimal("99.99"), "USD",
                "customer@example.com", "Test payment");

        for (PaymentProcessor processor : processors) {
            String adapterName = processor.getClass().getSimpleName();
            try {
                PaymentResult result = processor.process(request);
                out.println("  OK " + adapterName + ": " + result.message());
                out.println("     Transaction ID: " + result.transactionId());
            } catch (IllegalArgumentException e) {
                out.println("  FAILED " + adapterName + ": " + e.getMessage());
            }
            out.println();
        }
    }

    private void demonstrateDataSources() {
        out.println("Data Source Adapter Example:");

        List<DataSource> sources = List.of(
                new XmlDataAdapter(new XmlFeed()),
                new JsonDataAdapter(new JsonFeed(), new ObjectMapper()),
                new CsvDataAdapter(new CsvFile()));

        for (DataSource source : sources) {
            out.println("  " + source.getClass().getSimpleName() + " -> " + source.records());
        }
    }

    // Target interfaces

    interface PaymentProcessor {
        PaymentResult process(PaymentRequest request);
    }

    interface DataSource {
        List<Map<String, String>> records();
    }

    record PaymentRequest(BigDecimal amount, String currency, String customerEmail, String description) {}

    record PaymentResult(boolean success, String transactionId, String message) {}

    // Adaptees: third-party APIs with their own shapes

    static final class StripeGateway {
        private final AtomicInteger sequence = new AtomicInteger();

        String charge(long amountInCents, String currency, String email) {
            return "ch_" + (1000 + sequence.incrementAndGet()) + "_" + currency.toLowerCase(Locale.ROOT)
                    + "_" + amountInCents;
        }
    }

    static final class PayPalApi {
        Map<String, String> makePayment(double total, String currencyCode, String payerEmail) {
            return Map.of("id", "PAYID-" + Math.round(total * 100), "state", "approved", "payer", payerEmail);
        }
    }

    static final class SquareProcessor {
        int createPayment(long amountMoney, String currency) {
            if (!"USD".equals(currency)) {
                return -1;
            }
            return (int) (amountMoney % 10_000) + 70_000;
        }
    }

    // Adapters

    static final class StripePaymentAdapter implements PaymentProcessor {
        private final StripeGateway gateway;

        StripePaymentAdapter(StripeGateway gateway) {
            this.gateway = gateway;
        }

        @Override
        public PaymentResult process(PaymentRequest request) {
            long cents = toCents(request.amount());
            String chargeId = gateway.charge(cents, request.currency(), request.customerEmail());
            return new PaymentResult(true, chargeId, "Stripe charged " + formatted(request));
        }
    }

    static final class PayPalPaymentAdapter implements PaymentProcessor {
        private final PayPalApi api;

        PayPalPaymentAdapter(PayPalApi api) {
            this.api = api;
        }

        @Override
        public PaymentResult process(PaymentRequest request) {
            Map<String, String> payment = api.makePayment(request.amount().doubleValue(), request.currency(),
                    request.customerEmail());
            boolean approved = "approved".equals(payment.get("state"));
            return new PaymentResult(approved, payment.get("id"),
                    "PayPal payment " + payment.get("state") + " for " + formatted(request));
        }
    }

    static final class SquarePaymentAdapter implements PaymentProcessor {
        private final SquareProcessor processor;

        SquarePaymentAdapter(SquareProcessor processor) {
            this.processor = processor;
        }

        @Override
        public PaymentResult process(PaymentRequest request) {
            int paymentId = processor.createPayment(toCents(request.amount()), request.currency());
            if (paymentId < 0) {
                throw new IllegalArgumentException("Square does not accept " + request.currency());
            }
            return new PaymentResult(true, "sq_" + paymentId, "Square completed " + formatted(request));
        }
    }

    static final class XmlFeed {
        String fetchXml() {
            return "<users><user id=\"1\" name=\"Alice\"/><user id=\"2\" name=\"Bob\"/></users>";
        }
    }

    static final class JsonFeed {
        String fetchJson() {
            return "[{\"id\":\"3\",\"name\":\"Carol\"},{\"id\":\"6\",\"name\":\"Frank\"}]";
        }
    }

    static final class CsvFile {
        List<String> readLines() {
            return List.of("id,name", "4,Dave", "5,Erin");
        }
    }

    static final class XmlDataAdapter implements DataSource {
        private final XmlFeed feed;

        XmlDataAdapter(XmlFeed feed) {
            this.feed = feed;
        }

        @Override
        public List<Map<String, String>> records() {
            List<Map<String, String>> records = new ArrayList<>();
            for (String element : feed.fetchXml().split("<user ")) {
                if (element.contains("id=\"")) {
                    records.add(Map.of("id", attribute(element, "id"), "name", attribute(element, "name")));
                }
            }
            return records;
        }

        private static String attribute(String element, String name) {
            int start = element.indexOf(name + "=\"") + name.length() + 2;
            return element.substring(start, element.indexOf('"', start));
        }
    }

    static final class JsonDataAdapter implements DataSource {
        private static final TypeReference<List<Map<String, String>>> RECORDS = new TypeReference<>() {};

        private final JsonFeed feed;
        private final ObjectMapper mapper;

        JsonDataAdapter(JsonFeed feed, ObjectMapper mapper) {
            this.feed = feed;
            this.mapper = mapper;
        }

        @Override
        public List<Map<String, String>> records() {
            try {
                return mapper.readValue(feed.fetchJson(), RECORDS);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("malformed JSON feed", e);
            }
        }
    }

    static final class CsvDataAdapter implements DataSource {
        private final CsvFile file;

        CsvDataAdapter(CsvFile file) {
            this.file = file;
        }

        @Override
        public List<Map<String, String>> records() {
            List<String> lines = file.readLines();
            String[] header = lines.get(0).split(",");
            List<Map<String, String>> records = new ArrayList<>();
            for (String line : lines.subList(1, lines.size())) {
                String[] values = line.split(",");
                records.add(Map.of(header[0], values[0], header[1], values[1]));
            }
            return records;
        }
    }

    private static long toCents(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static String formatted(PaymentRequest request) {
        return request.amount().setScale(2, RoundingMode.HALF_UP).toPlainString() + " " + request.currency();
    }
}
