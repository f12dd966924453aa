/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Expands each source element into an iterator of its own. The next source element is only expanded once
 * the iterator of the previous one is used up.
 */
class FlatMappedIterator<T, U> extends LookaheadIterator<U> {

    private final Iterator<T> source;
    private final Function<T, FunctionalIterator<U>> expansionFn;
    @Nullable
    private Iterator<U> current;

    FlatMappedIterator(Iterator<T> source, Function<T, FunctionalIterator<U>> expansionFn) {
        this.source = source;
        this.expansionFn = expansionFn;
        this.current = null;
    }

    @Nullable
    @Override
    protected U fetch() {
        while (current == null || !current.hasNext()) {
            if (!source.hasNext()) return null;
            current = expansionFn.apply(source.next());
        }
        return current.next();
    }
}
