package org.javai.gof.catalog;

import org.javai.gof.Category;
import org.javai.gof.PatternDemo;
import org.javai.gof.patterns.behavioral.ChainOfResponsibilityDemo;
import org.javai.gof.patterns.behavioral.CommandDemo;
import org.javai.gof.patterns.behavioral.InterpreterDemo;
import org.javai.gof.patterns.behavioral.IteratorDemo;
import org.javai.gof.patterns.behavioral.MediatorDemo;
import org.javai.gof.patterns.behavioral.MementoDemo;
import org.javai.gof.patterns.behavioral.ObserverDemo;
import org.javai.gof.patterns.behavioral.StateDemo;
import org.javai.gof.patterns.behavioral.StrategyDemo;
import org.javai.gof.patterns.behavioral.TemplateMethodDemo;
import org.javai.gof.patterns.behavioral.VisitorDemo;
import org.javai.gof.patterns.creational.AbstractFactoryDemo;
import org.javai.gof.patterns.creational.BuilderDemo;
import org.javai.gof.patterns.creational.FactoryMethodDemo;
import org.javai.gof.patterns.creational.PrototypeDemo;
import org.javai.gof.patterns.creational.SingletonDemo;
import org.javai.gof.patterns.structural.AdapterDemo;
import org.javai.gof.patterns.structural.BridgeDemo;
import org.javai.gof.patterns.structural.CompositeDemo;
import org.javai.gof.patterns.structural.DecoratorDemo;
import org.javai.gof.patterns.structural.FacadeDemo;
import org.javai.gof.patterns.structural.FlyweightDemo;
import org.javai.gof.patterns.structural.ProxyDemo;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed list of demos the catalog can discover.
 *
 * <p>Demos are registered explicitly, each with its category tag. Registering a demo does
 * not create it: factories run only when a {@link PatternCatalog} is discovered, one at a
 * time, so one failing factory cannot keep the others from being listed.
 */
public final class DemoRegistry {

    private static final DemoRegistry STANDARD = builder()
            .register(Category.CREATIONAL, AbstractFactoryDemo.class, AbstractFactoryDemo::new)
            .register(Category.CREATIONAL, BuilderDemo.class, BuilderDemo::new)
            .register(Category.CREATIONAL, FactoryMethodDemo.class, FactoryMethodDemo::new)
            .register(Category.CREATIONAL, PrototypeDemo.class, PrototypeDemo::new)
            .register(Category.CREATIONAL, SingletonDemo.class, SingletonDemo::new)

            .register(Category.STRUCTURAL, AdapterDemo.class, AdapterDemo::new)
            .register(Category.STRUCTURAL, BridgeDemo.class, BridgeDemo::new)
            .register(Category.STRUCTURAL, CompositeDemo.class, CompositeDemo::new)
            .register(Category.STRUCTURAL, DecoratorDemo.class, DecoratorDemo::new)
            .register(Category.STRUCTURAL, FacadeDemo.class, FacadeDemo::new)
            .register(Category.STRUCTURAL, FlyweightDemo.class, FlyweightDemo::new)
            .register(Category.STRUCTURAL, ProxyDemo.class, ProxyDemo::new)

            .register(Category.BEHAVIORAL, ChainOfResponsibilityDemo.class, ChainOfResponsibilityDemo::new)
            .register(Category.BEHAVIORAL, CommandDemo.class, CommandDemo::new)
            .register(Category.BEHAVIORAL, InterpreterDemo.class, InterpreterDemo::new)
            .register(Category.BEHAVIORAL, IteratorDemo.class, IteratorDemo::new)
            .register(Category.BEHAVIORAL, MediatorDemo.class, MediatorDemo::new)
            .register(Category.BEHAVIORAL, MementoDemo.class, MementoDemo::new)
            .register(Category.BEHAVIORAL, ObserverDemo.class, ObserverDemo::new)
            .register(Category.BEHAVIORAL, StateDemo.class, StateDemo::new)
            .register(Category.BEHAVIORAL, StrategyDemo.class, StrategyDemo::new)
            .register(Category.BEHAVIORAL, TemplateMethodDemo.class, TemplateMethodDemo::new)
            .register(Category.BEHAVIORAL, VisitorDemo.class, VisitorDemo::new)
            .build();

    private final List<DemoRegistration> registrations;

    private DemoRegistry(List<DemoRegistration> registrations) {
        this.registrations = List.copyOf(registrations);
    }

    /**
     * The 23 Gang of Four pattern demos.
     */
    public static DemoRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * All registrations, in registration order.
     */
    public List<DemoRegistration> registrations() {
        return registrations;
    }

    public int size() {
        return registrations.size();
    }

    /**
     * Builder for a {@link DemoRegistry}.
     */
    public static final class Builder {
        private final List<DemoRegistration> registrations = new ArrayList<>();

        private Builder() {}

        /**
         * Registers a demo class; its simple name identifies the variant.
         */
        public Builder register(Category category, Class<? extends PatternDemo> type, DemoFactory factory) {
            return register(type.getSimpleName(), category, factory);
        }

        public Builder register(String variant, Category category, DemoFactory factory) {
            registrations.add(new DemoRegistration(variant, category, factory));
            return this;
        }

        public DemoRegistry build() {
            return new DemoRegistry(registrations);
        }
    }
}
