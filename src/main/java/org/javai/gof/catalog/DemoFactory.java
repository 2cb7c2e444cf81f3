package org.javai.gof.catalog;

import org.javai.gof.DemoContext;
import org.javai.gof.PatternDemo;

/**
 * Creates one pattern demo. Usually a constructor reference, e.g. {@code FacadeDemo::new}.
 */
@FunctionalInterface
public interface DemoFactory {

    PatternDemo create(DemoContext context) throws Exception;
}
