/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A lazy, single pass sequence. Every transformation returns a new iterator that pulls from this one
 * only as far as it is itself pulled.
 */
public interface FunctionalIterator<T> extends Iterator<T> {

    <U> FunctionalIterator<U> map(Function<T, U> mappingFn);

    <U> FunctionalIterator<U> flatMap(Function<T, FunctionalIterator<U>> mappingFn);

    FunctionalIterator<T> filter(Predicate<T> predicate);

    /**
     * @return the elements of this iterator followed by those of {@code iterator}
     */
    FunctionalIterator<T> link(FunctionalIterator<T> iterator);

    List<T> toList();

    long count();
}
