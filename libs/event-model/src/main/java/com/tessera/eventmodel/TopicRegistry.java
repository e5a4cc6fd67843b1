package com.tessera.eventmodel;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Two-way mapping between event classes and the topic strings stored with them.
 *
 * <p>Built explicitly by the application at startup; nothing is discovered from the classpath or
 * the environment. The usual way to build one is from the sealed interface that lists an entity's
 * events:
 *
 * <pre>{@code
 * sealed interface AccountEvent extends DomainEvent permits Opened, Deposited, Closed {}
 *
 * TopicRegistry topics = TopicRegistry.builder().registerSealed(AccountEvent.class).build();
 * }</pre>
 *
 * <p>{@link Snapshot} is always registered under {@link Snapshot#TOPIC}.
 */
public final class TopicRegistry {

    private final Map<String, Class<? extends DomainEvent>> typesByTopic;
    private final Map<Class<? extends DomainEvent>, String> topicsByType;

    private TopicRegistry(Map<String, Class<? extends DomainEvent>> typesByTopic) {
        this.typesByTopic = Collections.unmodifiableMap(new LinkedHashMap<>(typesByTopic));
        var inverse = new LinkedHashMap<Class<? extends DomainEvent>, String>();
        typesByTopic.forEach((topic, type) -> inverse.put(type, topic));
        this.topicsByType = Collections.unmodifiableMap(inverse);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the topic registered for the given event class.
     *
     * @throws MappingException if the class was never registered
     */
    public String topicOf(Class<? extends DomainEvent> type) {
        String topic = topicsByType.get(type);
        if (topic == null) {
            throw new MappingException("No topic registered for event type " + type.getName());
        }
        return topic;
    }

    /** Looks up the event class for a stored topic. */
    public Optional<Class<? extends DomainEvent>> typeOf(String topic) {
        return Optional.ofNullable(typesByTopic.get(topic));
    }

    /** Checks whether a topic is known to this registry. */
    public boolean isKnown(String topic) {
        return typesByTopic.containsKey(topic);
    }

    /** All registered topics, in registration order. */
    public Set<String> topics() {
        return typesByTopic.keySet();
    }

    /** Accumulates registrations; rejects any topic or class registered twice. */
    public static final class Builder {

        private final Map<String, Class<? extends DomainEvent>> typesByTopic =
                new LinkedHashMap<>();

        private Builder() {
            register(Snapshot.TOPIC, Snapshot.class);
        }

        /** Registers a class under an explicit topic. */
        public Builder register(String topic, Class<? extends DomainEvent> type) {
            if (topic == null || topic.isBlank()) {
                throw new IllegalArgumentException("topic must not be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
            if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
                throw new IllegalArgumentException(
                        "Only concrete event classes can be registered: " + type.getName());
            }
            if (typesByTopic.containsKey(topic)) {
                throw new IllegalArgumentException("Topic already registered: " + topic);
            }
            if (typesByTopic.containsValue(type)) {
                throw new IllegalArgumentException("Type already registered: " + type.getName());
            }
            typesByTopic.put(topic, type);
            return this;
        }

        /** Registers a class under its {@link Topic} annotation, or its simple name. */
        public Builder register(Class<? extends DomainEvent> type) {
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
            Topic annotation = type.getAnnotation(Topic.class);
            return register(annotation != null ? annotation.value() : type.getSimpleName(), type);
        }

        /**
         * Registers every concrete class permitted by a sealed hierarchy, descending into nested
         * sealed interfaces.
         */
        public Builder registerSealed(Class<? extends DomainEvent> sealedType) {
            if (sealedType == null || !sealedType.isSealed()) {
                throw new IllegalArgumentException("Not a sealed type: " + sealedType);
            }
            for (Class<?> permitted : sealedType.getPermittedSubclasses()) {
                Class<? extends DomainEvent> eventType = permitted.asSubclass(DomainEvent.class);
                if (permitted.isSealed()) {
                    registerSealed(eventType);
                } else {
                    register(eventType);
                }
            }
            return this;
        }

        public TopicRegistry build() {
            return new TopicRegistry(typesByTopic);
        }
    }
}
