/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;

public class Iterators {

    public static <T> FunctionalIterator<T> empty() {
        return iterate(Collections.emptyIterator());
    }

    public static <T> FunctionalIterator<T> single(T item) {
        return iterate(Collections.singletonList(item));
    }

    @SafeVarargs
    public static <T> FunctionalIterator<T> iterate(T... elements) {
        return iterate(Arrays.asList(elements));
    }

    public static <T> FunctionalIterator<T> iterate(Collection<T> collection) {
        return new BaseIterator<>(collection.iterator());
    }

    /**
     * Adapts a plain iterator, such as one returned by the store. Functional iterators are returned as they are.
     */
    @SuppressWarnings("unchecked")
    public static <T> FunctionalIterator<T> iterate(Iterator<T> iterator) {
        if (iterator instanceof FunctionalIterator<?>) return (FunctionalIterator<T>) iterator;
        return new BaseIterator<>(iterator);
    }
}
