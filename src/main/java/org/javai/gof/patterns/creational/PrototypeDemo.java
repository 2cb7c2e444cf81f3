package org.javai.gof.patterns.creational;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document templates registered once and cloned on demand. Clones are deep: each copy is
 * serialized to JSON and read back, so no list or map is shared with the template.
 */
public class PrototypeDemo extends AbstractPatternDemo {

    public PrototypeDemo(DemoContext context) {
        super(context, "Prototype",
                "Creates objects by cloning existing instances. "
                        + "Useful when object creation is expensive or when you need "
                        + "to create objects with similar state to existing ones.");
    }

    @Override
    public void demonstrate() {
        out.println("Document Template Prototype Example");
        out.println();

        DocumentTemplateManager manager = new DocumentTemplateManager(new ObjectMapper());

        Report report = new Report("Quarterly Sales Report", "Sales Team");
        report.addSection("Executive Summary");
        report.addSection("Revenue Analysis");
        report.putMetadata("department", "Sales");
        report.putMetadata("confidentiality", "Internal");
        manager.register("quarterly-report", report);

        Letter letter = new Letter("Customer Welcome Letter", "Customer Success");
        letter.setRecipient("[Customer Name]");
        letter.putMetadata("template", "welcome");
        manager.register("welcome-letter", letter);

        out.println("Registered templates: " + manager.templateNames());
        out.println();

        Report q1 = manager.create("quarterly-report", Report.class);
        q1.setTitle("Q1 2024 Sales Report");
        q1.addSection("Regional Breakdown");

        Report q2 = manager.create("quarterly-report", Report.class);
        q2.setTitle("Q2 2024 Sales Report");
        q2.putMetadata("reviewed", "true");

        Letter welcome = manager.create("welcome-letter", Letter.class);
        welcome.setRecipient("Jane Doe");

        out.println("Cloned documents:");
        q1.describe(out);
        q2.describe(out);
        welcome.describe(out);
        out.println();

        out.println("Template is unchanged after customizing its clones:");
        report.describe(out);
        letter.describe(out);
    }

    /**
     * Base document. Jackson needs the no-argument constructors and setters to rebuild a copy.
     */
    public abstract static class Document {
        private String title;
        private String author;
        private Map<String, String> metadata = new LinkedHashMap<>();

        Document() {}

        Document(String title, String author) {
            this.title = title;
            this.author = author;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getAuthor() {
            return author;
        }

        public void setAuthor(String author) {
            this.author = author;
        }

        public Map<String, String> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, String> metadata) {
            this.metadata = metadata;
        }

        public void putMetadata(String key, String value) {
            metadata.put(key, value);
        }

        abstract void describe(PrintStream out);
    }

    public static class Report extends Document {
        private List<String> sections = new ArrayList<>();

        public Report() {}

        Report(String title, String author) {
            super(title, author);
        }

        public List<String> getSections() {
            return sections;
        }

        public void setSections(List<String> sections) {
            this.sections = sections;
        }

        public void addSection(String section) {
            sections.add(section);
        }

        @Override
        void describe(PrintStream out) {
            out.println("  Report: " + getTitle() + " by " + getAuthor()
                    + " | sections=" + sections + " | metadata=" + getMetadata());
        }
    }

    public static class Letter extends Document {
        private String recipient;

        public Letter() {}

        Letter(String title, String author) {
            super(title, author);
        }

        public String getRecipient() {
            return recipient;
        }

        public void setRecipient(String recipient) {
            this.recipient = recipient;
        }

        @Override
        void describe(PrintStream out) {
            out.println("  Letter: " + getTitle() + " to " + recipient
                    + " from " + getAuthor() + " | metadata=" + getMetadata());
        }
    }

    /**
     * Registry of prototypes keyed by template name.
     */
    static final class DocumentTemplateManager {
        private final ObjectMapper mapper;
        private final Map<String, Document> templates = new LinkedHashMap<>();

        DocumentTemplateManager(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        void register(String name, Document template) {
            templates.put(name, template);
        }

        List<String> templateNames() {
            return new ArrayList<>(templates.keySet());
        }

        <D extends Document> D create(String name, Class<D> type) {
            Document template = templates.get(name);
            if (template == null) {
                throw new IllegalArgumentException("Template not found: " + name);
            }
            return type.cast(deepCopy(template));
        }

        private Document deepCopy(Document template) {
            try {
                String json = mapper.writeValueAsString(template);
                return mapper.readValue(json, template.getClass());
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("could not clone template " + template.getTitle(), e);
            }
        }
    }
}
