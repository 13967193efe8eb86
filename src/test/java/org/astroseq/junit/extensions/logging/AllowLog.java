package org.astroseq.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Permits log events of the given level whose logger and message match the patterns. The
 * event may or may not occur.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Repeatable(AllowLogs.class)
public @interface AllowLog {

    LogLevel level();

    /** Regular expression matched against the full logger name. */
    String loggerPattern() default ".*";

    /** Regular expression matched against the formatted message. */
    String messagePattern() default ".*";
}
