/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import javax.annotation.Nullable;
import java.util.NoSuchElementException;

/**
 * An iterator that computes its elements one at a time and holds at most one of them ahead of the caller.
 * Subclasses produce elements through {@link #fetch()}; elements can therefore never be null.
 */
public abstract class LookaheadIterator<T> extends AbstractFunctionalIterator<T> {

    @Nullable
    private T next;

    /**
     * @return the next element, or null when there are no more
     */
    @Nullable
    protected abstract T fetch();

    @Override
    public boolean hasNext() {
        if (next == null) next = fetch();
        return next != null;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        T result = next;
        next = null;
        return result;
    }
}
