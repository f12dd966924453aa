/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.graph;

/**
 * A node or relationship held by the store. Property access does not go through the entity itself
 * but through the {@link QueryContext.Operations} of its kind, so that every read hits the store.
 */
public interface Entity {

    long id();
}
