/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Applies its function on every pull, with nothing held ahead, so the function may return null.
 */
class MappedIterator<T, U> extends AbstractFunctionalIterator<U> {

    private final Iterator<T> source;
    private final Function<T, U> mappingFn;

    MappedIterator(Iterator<T> source, Function<T, U> mappingFn) {
        this.source = source;
        this.mappingFn = mappingFn;
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public U next() {
        return mappingFn.apply(source.next());
    }
}
