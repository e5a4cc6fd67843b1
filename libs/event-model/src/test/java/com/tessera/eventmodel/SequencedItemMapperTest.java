package com.tessera.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.eventmodel.AccountEvents.Closed;
import com.tessera.eventmodel.AccountEvents.Deposited;
import com.tessera.eventmodel.AccountEvents.Opened;
import com.tessera.eventmodel.cipher.AesGcmCipherStrategy;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SequencedItemMapper")
class SequencedItemMapperTest {

    private static final Instant OPENED_AT = Instant.parse("2025-03-01T09:30:00.123Z");

    private final SequencedItemMapper plain = new SequencedItemMapper(AccountEvents.topics());
    private final SequencedItemMapper encrypting = new SequencedItemMapper(
            AccountEvents.topics(),
            AesGcmCipherStrategy.fromBase64Key(AesGcmCipherStrategy.generateBase64Key()));

    private static Opened opened() {
        return new Opened("acc-1", 0, "Ada Lovelace", OPENED_AT);
    }

    @Nested
    @DisplayName("toSequencedItem()")
    class ToSequencedItem {

        @Test
        @DisplayName("copies identifying fields and resolves the topic")
        void identifyingFields() {
            var item = plain.toSequencedItem(opened(), HashChain.GENESIS);

            assertThat(item.originatorId()).isEqualTo("acc-1");
            assertThat(item.position()).isZero();
            assertThat(item.topic()).isEqualTo("Opened");
            assertThat(item.originatorHash()).isEqualTo(HashChain.GENESIS);
        }

        @Test
        @DisplayName("uses the @Topic annotation when present")
        void annotatedTopic() {
            var item = plain.toSequencedItem(
                    new Deposited("acc-1", 1, 500, List.of()), "prev");
            assertThat(item.topic()).isEqualTo("account.Deposited");
        }

        @Test
        @DisplayName("keeps identifying fields out of the stored state")
        void stateExcludesIdentity() {
            var item = plain.toSequencedItem(opened(), HashChain.GENESIS);

            assertThat(item.state())
                    .contains("\"owner\":\"Ada Lovelace\"")
                    .contains("2025-03-01T09:30:00.123Z")
                    .doesNotContain("originatorId")
                    .doesNotContain("originatorVersion");
        }

        @Test
        @DisplayName("stores a hash that verifies")
        void hashVerifies() {
            var item = plain.toSequencedItem(opened(), HashChain.GENESIS);
            assertThat(HashChain.hasValidHash(item)).isTrue();
        }

        @Test
        @DisplayName("rejects an event with a blank originator id")
        void blankOriginator() {
            assertThatThrownBy(() -> plain.toSequencedItem(
                    new Opened(" ", 0, "x", OPENED_AT), HashChain.GENESIS))
                    .isInstanceOf(MappingException.class)
                    .hasMessageContaining("originatorId");
        }

        @Test
        @DisplayName("rejects a negative version")
        void negativeVersion() {
            assertThatThrownBy(() -> plain.toSequencedItem(
                    new Opened("acc-1", -1, "x", OPENED_AT), HashChain.GENESIS))
                    .isInstanceOf(MappingException.class)
                    .hasMessageContaining("originatorVersion");
        }

        @Test
        @DisplayName("rejects a missing predecessor hash")
        void nullOriginatorHash() {
            assertThatThrownBy(() -> plain.toSequencedItem(opened(), null))
                    .isInstanceOf(MappingException.class);
        }

        @Test
        @DisplayName("rejects an unregistered event type")
        void unregisteredType() {
            var registry = TopicRegistry.builder().register(Opened.class).build();
            var mapper = new SequencedItemMapper(registry);

            assertThatThrownBy(() -> mapper.toSequencedItem(
                    new Closed("acc-1", 1, "done"), "prev"))
                    .isInstanceOf(MappingException.class)
                    .hasMessageContaining(Closed.class.getName());
        }
    }

    @Nested
    @DisplayName("fromSequencedItem()")
    class FromSequencedItem {

        @Test
        @DisplayName("round-trips an event without encryption")
        void roundTripPlain() {
            var event = new Deposited("acc-1", 1, 2_500, List.of("salary", "march"));
            var item = plain.toSequencedItem(event, "prev-hash");

            assertThat(plain.fromSequencedItem(item, "prev-hash")).isEqualTo(event);
        }

        @Test
        @DisplayName("round-trips an event with encryption")
        void roundTripEncrypted() {
            var item = encrypting.toSequencedItem(opened(), HashChain.GENESIS);

            assertThat(encrypting.fromSequencedItem(item, HashChain.GENESIS))
                    .isEqualTo(opened());
        }

        @Test
        @DisplayName("takes identity from the item, not the payload")
        void identityFromItem() {
            var item = plain.toSequencedItem(new Closed("acc-9", 4, "fraud"), "p");
            var event = (Closed) plain.fromSequencedItem(item, "p");

            assertThat(event.originatorId()).isEqualTo("acc-9");
            assertThat(event.originatorVersion()).isEqualTo(4);
        }

        @Test
        @DisplayName("fails with DataIntegrityException when the state was altered")
        void tamperedState() {
            var item = plain.toSequencedItem(opened(), HashChain.GENESIS);
            var tampered = new SequencedItem(item.originatorId(), item.position(), item.topic(),
                    item.state().replace("Ada", "Eve"), item.originatorHash(), item.eventHash());

            assertThatThrownBy(() -> plain.fromSequencedItem(tampered, HashChain.GENESIS))
                    .isInstanceOfSatisfying(DataIntegrityException.class, e -> {
                        assertThat(e.originatorId()).isEqualTo("acc-1");
                        assertThat(e.position()).isZero();
                    });
        }

        @Test
        @DisplayName("fails with DataIntegrityException when the predecessor does not match")
        void wrongPredecessor() {
            var item = plain.toSequencedItem(
                    new Deposited("acc-1", 1, 100, List.of()), "hash-of-0");

            assertThatThrownBy(() -> plain.fromSequencedItem(item, "some-other-hash"))
                    .isInstanceOfSatisfying(DataIntegrityException.class,
                            e -> assertThat(e.position()).isEqualTo(1));
        }

        @Test
        @DisplayName("fails with MappingException for an unknown topic")
        void unknownTopic() {
            String hash = HashChain.eventHash("Vanished", "{}", "acc-1", 0, HashChain.GENESIS);
            var item = new SequencedItem("acc-1", 0, "Vanished", "{}", HashChain.GENESIS, hash);

            assertThatThrownBy(() -> plain.fromSequencedItem(item, HashChain.GENESIS))
                    .isInstanceOf(MappingException.class)
                    .hasMessageContaining("Vanished");
        }

        @Test
        @DisplayName("fails with MappingException for a malformed payload")
        void malformedPayload() {
            String state = "{\"owner\":";
            String hash = HashChain.eventHash("Opened", state, "acc-1", 0, HashChain.GENESIS);
            var item = new SequencedItem("acc-1", 0, "Opened", state, HashChain.GENESIS, hash);

            assertThatThrownBy(() -> plain.fromSequencedItem(item, HashChain.GENESIS))
                    .isInstanceOf(MappingException.class);
        }

        @Test
        @DisplayName("fails with MappingException for an incomplete item")
        void incompleteItem() {
            var item = new SequencedItem("acc-1", 0, null, "{}", HashChain.GENESIS, "h");

            assertThatThrownBy(() -> plain.fromSequencedItem(item, HashChain.GENESIS))
                    .isInstanceOf(MappingException.class)
                    .hasMessageContaining("topic");
        }

        @Test
        @DisplayName("fails with DataIntegrityException when decrypted with the wrong key")
        void wrongKey() {
            var item = encrypting.toSequencedItem(opened(), HashChain.GENESIS);
            var otherKey = new SequencedItemMapper(
                    AccountEvents.topics(),
                    AesGcmCipherStrategy.fromBase64Key(AesGcmCipherStrategy.generateBase64Key()));

            assertThatThrownBy(() -> otherKey.fromSequencedItem(item, HashChain.GENESIS))
                    .isInstanceOf(DataIntegrityException.class)
                    .hasMessageContaining("decrypted");
        }
    }

    @Nested
    @DisplayName("encryption")
    class Encryption {

        @Test
        @DisplayName("no plaintext attribute value appears in the stored state")
        void opaqueState() {
            var item = encrypting.toSequencedItem(
                    new Deposited("acc-1", 1, 987_654, List.of("confidential-tag")), "p");

            assertThat(item.state())
                    .doesNotContain("987654")
                    .doesNotContain("confidential-tag")
                    .doesNotContain("amountCents");
        }

        @Test
        @DisplayName("leaves identifying fields visible so the chain verifies without the key")
        void chainVerifiesWithoutKey() {
            var item = encrypting.toSequencedItem(opened(), HashChain.GENESIS);

            assertThat(item.originatorId()).isEqualTo("acc-1");
            assertThat(item.topic()).isEqualTo("Opened");
            plain.verifyHash(item);
        }
    }
}
