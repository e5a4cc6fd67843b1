package com.tessera.eventmodel;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 hash chain binding each stored item to its predecessor.
 *
 * <p>An item's event hash covers its topic, state as stored, originator id, position and
 * originator hash. Each field is fed to the digest as a 4-byte big-endian length followed by its
 * UTF-8 bytes, so no two different field tuples share an encoding. Because the originator hash is
 * itself the previous item's event hash, changing any byte anywhere in a stream changes every
 * later event hash.
 */
public final class HashChain {

    /** Originator hash of the first item in every stream. */
    public static final String GENESIS = "";

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private HashChain() {
        // utility class
    }

    /** Computes the event hash for the given fields. */
    public static String eventHash(
            String topic, String state, String originatorId, long position, String originatorHash) {
        MessageDigest digest = newDigest();
        update(digest, topic);
        update(digest, state);
        update(digest, originatorId);
        update(digest, Long.toString(position));
        update(digest, originatorHash);
        return HEX.formatHex(digest.digest());
    }

    /** Recomputes the event hash from an item's stored fields. */
    public static String eventHash(SequencedItem item) {
        return eventHash(
                item.topic(),
                item.state(),
                item.originatorId(),
                item.position(),
                item.originatorHash());
    }

    /** Checks whether an item's stored event hash matches its fields. */
    public static boolean hasValidHash(SequencedItem item) {
        if (item.topic() == null
                || item.state() == null
                || item.originatorId() == null
                || item.originatorHash() == null
                || item.eventHash() == null) {
            return false;
        }
        return item.eventHash().equals(eventHash(item));
    }

    /**
     * Verifies a single item: its own hash, and its link to the expected predecessor hash. The
     * item at position 0 must link to {@link #GENESIS} whatever the caller expects.
     *
     * @throws DataIntegrityException at the item's position if either check fails
     */
    public static void verify(SequencedItem item, String expectedOriginatorHash) {
        if (!hasValidHash(item)) {
            throw new DataIntegrityException(
                    item.originatorId(), item.position(), "recomputed event hash does not match");
        }
        if (item.position() == 0 && !GENESIS.equals(item.originatorHash())) {
            throw new DataIntegrityException(
                    item.originatorId(), 0, "first item does not start the chain");
        }
        if (!item.originatorHash().equals(expectedOriginatorHash)) {
            throw new DataIntegrityException(
                    item.originatorId(),
                    item.position(),
                    "originator hash does not match the preceding item");
        }
    }

    /**
     * Walks an ascending run of items and verifies every hash and every link.
     *
     * @param items items of one originator in ascending, consecutive position order
     * @param startingHash hash the first item must link to
     * @return the event hash of the last item, or {@code startingHash} if the run is empty
     * @throws DataIntegrityException at the first position that breaks
     */
    public static String verify(List<SequencedItem> items, String startingHash) {
        String expected = startingHash;
        Long previousPosition = null;
        for (SequencedItem item : items) {
            if (previousPosition != null && item.position() != previousPosition + 1) {
                throw new DataIntegrityException(
                        item.originatorId(),
                        item.position(),
                        "expected position " + (previousPosition + 1));
            }
            verify(item, expected);
            expected = item.eventHash();
            previousPosition = item.position();
        }
        return expected;
    }

    private static void update(MessageDigest digest, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
