package org.javai.gof.patterns.creational;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Payment processors chosen at runtime from a payment type string.
 */
public class FactoryMethodDemo extends AbstractPatternDemo {

    public FactoryMethodDemo(DemoContext context) {
        super(context, "Factory Method",
                "Creates objects without specifying their exact classes. "
                        + "Useful when the type of object needs to be determined at runtime "
                        + "based on configuration or user input.");
    }

    @Override
    public void demonstrate() {
        out.println("Payment Processing Factory Example");
        out.println();

        processPayment("credit-card", new BigDecimal("150.00"));
        processPayment("paypal", new BigDecimal("89.99"));
        processPayment("bank-transfer", new BigDecimal("250.00"));
        processPayment("crypto", new BigDecimal("75.50"));
        // not supported: the factory refuses it
        processPayment("carrier-pigeon", new BigDecimal("10.00"));
    }

    private void processPayment(String paymentType, BigDecimal amount) {
        try {
            PaymentProcessor processor = PaymentProcessorFactory.create(paymentType);
            out.println("SUCCESS " + paymentType + ": " + processor.process(amount));
        } catch (IllegalArgumentException e) {
            out.println("ERROR " + paymentType + ": " + e.getMessage());
        }
        out.println();
    }

    interface PaymentProcessor {
        String process(BigDecimal amount);
    }

    static final class CreditCardProcessor implements PaymentProcessor {
        @Override
        public String process(BigDecimal amount) {
            String transactionId = UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
            return "Credit card payment of $" + money(amount) + " processed. Transaction ID: " + transactionId;
        }
    }

    static final class PayPalProcessor implements PaymentProcessor {
        @Override
        public String process(BigDecimal amount) {
            int reference = ThreadLocalRandom.current().nextInt(1000, 10000);
            return "PayPal payment of $" + money(amount) + " processed. Reference: PP-" + reference;
        }
    }

    static final class BankTransferProcessor implements PaymentProcessor {
        @Override
        public String process(BigDecimal amount) {
            int transferId = ThreadLocalRandom.current().nextInt(100000, 1000000);
            return "Bank transfer of $" + money(amount) + " initiated. Transfer ID: BT" + transferId;
        }
    }

    static final class CryptoProcessor implements PaymentProcessor {
        @Override
        public String process(BigDecimal amount) {
            String block = Integer.toHexString(ThreadLocalRandom.current().nextInt()).toUpperCase(Locale.ROOT);
            return "Cryptocurrency payment of $" + money(amount) + " confirmed. Block: 0x" + block;
        }
    }

    /**
     * The factory: maps a payment type, with its accepted aliases, to a processor.
     */
    static final class PaymentProcessorFactory {

        private PaymentProcessorFactory() {}

        static PaymentProcessor create(String paymentType) {
            switch (paymentType.toLowerCase(Locale.ROOT)) {
                case "credit-card":
                case "creditcard":
                    return new CreditCardProcessor();
                case "paypal":
                    return new PayPalProcessor();
                case "bank-transfer":
                case "banktransfer":
                    return new BankTransferProcessor();
                case "crypto":
                case "cryptocurrency":
                    return new CryptoProcessor();
                default:
                    throw new IllegalArgumentException("Unsupported payment type: " + paymentType);
            }
        }
    }

    private static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
