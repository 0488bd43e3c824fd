package dev.chordshield.spring.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates ChordPro content passed to a handler method before the method runs.
 * <p>
 * The content is the parameter marked with {@link ChordProContent}, or the first
 * {@link CharSequence} parameter when none is marked.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidateChordPro {

    /**
     * Language code for notation and messages. Empty uses {@code chordshield.language}.
     */
    String language() default "";

    /**
     * Whether warnings reject the content as well as errors.
     */
    boolean rejectOnWarnings() default false;
}
