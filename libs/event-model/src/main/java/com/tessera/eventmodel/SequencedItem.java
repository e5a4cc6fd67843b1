package com.tessera.eventmodel;

/**
 * The unit of storage: one immutable record per (originator id, position).
 *
 * <p>Items of one originator, ordered by position, form a hash chain: each item's {@code
 * originatorHash} is the {@code eventHash} of the item before it, and the first item carries
 * {@link HashChain#GENESIS}.
 *
 * @param originatorId identifier of the entity or stream the event belongs to
 * @param position zero-based, gap-free index of the event within its originator's stream
 * @param topic logical type of the event; selects the deserialization target
 * @param state serialized (and possibly encrypted) event payload, opaque to the store
 * @param originatorHash event hash of the previous item, or {@link HashChain#GENESIS}
 * @param eventHash hash over this item's other fields, see {@link HashChain}
 */
public record SequencedItem(
        String originatorId,
        long position,
        String topic,
        String state,
        String originatorHash,
        String eventHash) {}
