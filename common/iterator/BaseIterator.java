/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.iterator;

import java.util.Iterator;

class BaseIterator<T> extends AbstractFunctionalIterator<T> {

    private final Iterator<T> source;

    BaseIterator(Iterator<T> source) {
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public T next() {
        return source.next();
    }
}
