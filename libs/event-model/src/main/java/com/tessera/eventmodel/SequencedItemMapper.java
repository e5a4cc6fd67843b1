package com.tessera.eventmodel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.eventmodel.cipher.CipherException;
import com.tessera.eventmodel.cipher.CipherStrategy;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts domain events to {@link SequencedItem}s and back.
 *
 * <p>Writing: the event's attributes other than {@code originatorId} and {@code
 * originatorVersion} are serialized to JSON, encrypted when a {@link CipherStrategy} is
 * configured, and hashed together with the identifying fields and the predecessor's hash.
 *
 * <p>Reading runs in a fixed order: the item's own hash is recomputed from its stored fields,
 * then its link to the expected predecessor is checked, and only then is the state decrypted and
 * bound to the class registered for its topic. Chain verification therefore never needs the key.
 */
public final class SequencedItemMapper {

    private static final Logger log = LoggerFactory.getLogger(SequencedItemMapper.class);

    static final String ORIGINATOR_ID = "originatorId";
    static final String ORIGINATOR_VERSION = "originatorVersion";

    private final TopicRegistry topics;
    private final CipherStrategy cipher;

    /** Creates a mapper that stores payloads as plain JSON. */
    public SequencedItemMapper(TopicRegistry topics) {
        this(topics, null);
    }

    /**
     * Creates a mapper that encrypts payloads with the given cipher.
     *
     * @param topics registry used to resolve topics in both directions
     * @param cipher cipher for payloads, or {@code null} to store plain JSON
     */
    public SequencedItemMapper(TopicRegistry topics, CipherStrategy cipher) {
        if (topics == null) {
            throw new IllegalArgumentException("topics must not be null");
        }
        this.topics = topics;
        this.cipher = cipher;
    }

    /**
     * Maps an event to the item that stores it.
     *
     * @param event the event; its version becomes the item's position
     * @param originatorHash event hash of the previous item, or {@link HashChain#GENESIS}
     * @throws MappingException if required fields are missing or the event type is unregistered
     */
    public SequencedItem toSequencedItem(DomainEvent event, String originatorHash) {
        EventValidator.validate(event).orThrow("Domain event");
        if (originatorHash == null) {
            throw new MappingException("originatorHash must not be null");
        }
        String topic = topics.topicOf(event.getClass());

        ObjectNode attributes = EventSerializer.toTree(event);
        attributes.remove(ORIGINATOR_ID);
        attributes.remove(ORIGINATOR_VERSION);
        String state = seal(EventSerializer.write(attributes));

        String eventHash = HashChain.eventHash(
                topic, state, event.originatorId(), event.originatorVersion(), originatorHash);
        return new SequencedItem(
                event.originatorId(),
                event.originatorVersion(),
                topic,
                state,
                originatorHash,
                eventHash);
    }

    /**
     * Verifies an item and maps it back to its event.
     *
     * @param item the stored item
     * @param expectedOriginatorHash event hash of the item that precedes it
     * @throws DataIntegrityException if the item's hash or its link to the predecessor is wrong,
     *     or its state cannot be decrypted
     * @throws MappingException if the item is incomplete, its topic is unknown, or its state does
     *     not bind to the registered type
     */
    public DomainEvent fromSequencedItem(SequencedItem item, String expectedOriginatorHash) {
        EventValidator.validate(item).orThrow("Sequenced item");
        HashChain.verify(item, expectedOriginatorHash);

        Class<? extends DomainEvent> type = topics.typeOf(item.topic())
                .orElseThrow(() -> new MappingException(
                        "Unknown topic '%s' at position %d of originator '%s'"
                                .formatted(item.topic(), item.position(), item.originatorId())));

        ObjectNode attributes = EventSerializer.readObject(open(item));
        attributes.put(ORIGINATOR_ID, item.originatorId());
        attributes.put(ORIGINATOR_VERSION, item.position());
        return EventSerializer.fromTree(attributes, type);
    }

    /**
     * Recomputes an item's hash without decoding it.
     *
     * @throws DataIntegrityException if the stored hash does not match
     */
    public void verifyHash(SequencedItem item) {
        EventValidator.validate(item).orThrow("Sequenced item");
        if (!HashChain.hasValidHash(item)) {
            throw new DataIntegrityException(
                    item.originatorId(), item.position(), "recomputed event hash does not match");
        }
    }

    /** Whether payloads are encrypted. */
    public boolean isEncrypting() {
        return cipher != null;
    }

    public TopicRegistry topics() {
        return topics;
    }

    private String seal(String json) {
        if (cipher == null) {
            return json;
        }
        byte[] encrypted = cipher.encrypt(json.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(encrypted);
    }

    private String open(SequencedItem item) {
        if (cipher == null) {
            return item.state();
        }
        try {
            byte[] encrypted = Base64.getDecoder().decode(item.state());
            return new String(cipher.decrypt(encrypted), StandardCharsets.UTF_8);
        } catch (CipherException | IllegalArgumentException e) {
            log.error("Could not decrypt state of originator '{}' at position {}",
                    item.originatorId(), item.position());
            throw new DataIntegrityException(
                    item.originatorId(), item.position(), "state could not be decrypted", e);
        }
    }
}
