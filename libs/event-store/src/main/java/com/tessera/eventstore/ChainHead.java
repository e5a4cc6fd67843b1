package com.tessera.eventstore;

import com.tessera.eventmodel.HashChain;

/**
 * Last link of a verified stream.
 *
 * @param originatorId stream that was verified
 * @param position position of the last item, or {@code -1} for an empty stream
 * @param eventHash event hash of the last item, or {@link HashChain#GENESIS}
 */
public record ChainHead(String originatorId, long position, String eventHash) {

    static ChainHead empty(String originatorId) {
        return new ChainHead(originatorId, -1, HashChain.GENESIS);
    }

    public boolean isEmpty() {
        return position < 0;
    }
}
