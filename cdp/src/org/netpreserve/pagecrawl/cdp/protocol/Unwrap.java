package org.netpreserve.pagecrawl.cdp.protocol;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a domain method whose result object has a single interesting field. The proxy returns the value of that
 * field instead of the whole result.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Unwrap {
    /**
     * Name of the result field. Defaults to the return type's simple name with a lowercase first letter.
     */
    String value() default "";
}
