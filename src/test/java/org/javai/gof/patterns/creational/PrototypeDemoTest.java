package org.javai.gof.patterns.creational;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.gof.patterns.creational.PrototypeDemo.DocumentTemplateManager;
import org.javai.gof.patterns.creational.PrototypeDemo.Letter;
import org.javai.gof.patterns.creational.PrototypeDemo.Report;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PrototypeDemoTest {

    private DocumentTemplateManager manager;
    private Report template;

    @BeforeEach
    void setUp() {
        manager = new DocumentTemplateManager(new ObjectMapper());
        template = new Report("Quarterly", "Sales Team");
        template.addSection("Summary");
        template.putMetadata("department", "Sales");
        manager.register("report", template);
    }

    @Test
    void create_returnsEqualButIndependentCopy() {
        Report copy = manager.create("report", Report.class);

        assertThat(copy).isNotSameAs(template);
        assertThat(copy.getTitle()).isEqualTo("Quarterly");
        assertThat(copy.getAuthor()).isEqualTo("Sales Team");
        assertThat(copy.getSections()).containsExactly("Summary");
        assertThat(copy.getMetadata()).containsEntry("department", "Sales");
    }

    @Test
    void create_isDeep() {
        Report copy = manager.create("report", Report.class);
        copy.setTitle("Q1");
        copy.addSection("Regions");
        copy.putMetadata("reviewed", "true");

        assertThat(template.getTitle()).isEqualTo("Quarterly");
        assertThat(template.getSections()).containsExactly("Summary");
        assertThat(template.getMetadata()).doesNotContainKey("reviewed");
        assertThat(copy.getSections()).isNotSameAs(template.getSections());
    }

    @Test
    void create_keepsSubtypeFields() {
        Letter letter = new Letter("Welcome", "Support");
        letter.setRecipient("Jane");
        manager.register("letter", letter);

        Letter copy = manager.create("letter", Letter.class);

        assertThat(copy.getRecipient()).isEqualTo("Jane");
        assertThat(copy.getTitle()).isEqualTo("Welcome");
    }

    @Test
    void create_unknownTemplate_fails() {
        assertThatThrownBy(() -> manager.create("memo", Report.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Template not found: memo");
    }

    @Test
    void create_wrongType_fails() {
        assertThatThrownBy(() -> manager.create("report", Letter.class))
                .isInstanceOf(ClassCastException.class);
    }

    @Test
    void templateNames_inRegistrationOrder() {
        manager.register("letter", new Letter("Welcome", "Support"));

        assertThat(manager.templateNames()).containsExactly("report", "letter");
    }
}
