package org.javai.gof.patterns.creational;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.creational.SingletonDemo.AppLogger;
import org.javai.gof.patterns.creational.SingletonDemo.CacheManager;
import org.javai.gof.patterns.creational.SingletonDemo.ConfigurationManager;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class SingletonDemoTest {

    @Test
    void getInstance_alwaysReturnsTheSameObject() {
        assertThat(AppLogger.getInstance()).isSameAs(AppLogger.getInstance());
        assertThat(CacheManager.getInstance()).isSameAs(CacheManager.getInstance());
        assertThat(CacheManager.instancesCreated()).isEqualTo(1);
    }

    @Test
    void enumSingleton_sharesState() {
        ConfigurationManager.INSTANCE.set("test.key", "value");

        assertThat(ConfigurationManager.INSTANCE.get("test.key")).isEqualTo("value");
    }

    @Test
    void demonstrate_runTwiceInOneProcess_printsTheSameNarration() {
        String firstRun = runDemo();
        String secondRun = runDemo();

        assertThat(firstRun).contains("Entries logged through either reference: 2");
        assertThat(secondRun).isEqualTo(firstRun);
    }

    private static String runDemo() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        new SingletonDemo(DemoContext.immediate(out)).demonstrate();
        return output.toString(StandardCharsets.UTF_8);
    }
}
