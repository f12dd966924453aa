/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import javax.annotation.Nullable;
import java.util.LinkedList;
import java.util.List;

class LinkedIterators<T> extends LookaheadIterator<T> {

    private final LinkedList<FunctionalIterator<T>> remaining;

    LinkedIterators(List<FunctionalIterator<T>> iterators) {
        this.remaining = new LinkedList<>(iterators);
    }

    /**
     * Appends to this chain instead of nesting it inside another one.
     */
    @Override
    public FunctionalIterator<T> link(FunctionalIterator<T> iterator) {
        remaining.addLast(iterator);
        return this;
    }

    @Nullable
    @Override
    protected T fetch() {
        while (!remaining.isEmpty()) {
            FunctionalIterator<T> head = remaining.getFirst();
            if (head.hasNext()) return head.next();
            remaining.removeFirst();
        }
        return null;
    }
}
