/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

public abstract class AbstractFunctionalIterator<T> implements FunctionalIterator<T> {

    @Override
    public <U> FunctionalIterator<U> map(Function<T, U> mappingFn) {
        return new MappedIterator<>(this, mappingFn);
    }

    @Override
    public <U> FunctionalIterator<U> flatMap(Function<T, FunctionalIterator<U>> mappingFn) {
        return new FlatMappedIterator<>(this, mappingFn);
    }

    @Override
    public FunctionalIterator<T> filter(Predicate<T> predicate) {
        return new FilteredIterator<>(this, predicate);
    }

    @Override
    public FunctionalIterator<T> link(FunctionalIterator<T> iterator) {
        return new LinkedIterators<>(ImmutableList.of(this, iterator));
    }

    @Override
    public List<T> toList() {
        List<T> list = new ArrayList<>();
        while (hasNext()) list.add(next());
        return list;
    }

    @Override
    public long count() {
        long count = 0;
        for (; hasNext(); count++) next();
        return count;
    }
}
