/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.function.Predicate;

class FilteredIterator<T> extends LookaheadIterator<T> {

    private final Iterator<T> source;
    private final Predicate<T> predicate;

    FilteredIterator(Iterator<T> source, Predicate<T> predicate) {
        this.source = source;
        this.predicate = predicate;
    }

    @Nullable
    @Override
    protected T fetch() {
        while (source.hasNext()) {
            T candidate = source.next();
            if (predicate.test(candidate)) return candidate;
        }
        return null;
    }
}
