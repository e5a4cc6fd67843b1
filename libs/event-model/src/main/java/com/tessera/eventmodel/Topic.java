package com.tessera.eventmodel;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the topic under which an event class is registered. Without it, the class's simple
 * name is used.
 *
 * <p>Pin a topic explicitly when the class may later be renamed or moved: the topic is written to
 * storage and must keep resolving to the same type.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Topic {

    /** The topic string stored with every item of this type. */
    String value();
}
