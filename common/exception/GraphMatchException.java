/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.exception;

import java.util.Objects;

public class GraphMatchException extends RuntimeException {

    private final ErrorMessage error;

    private GraphMatchException(ErrorMessage error, Throwable cause) {
        super(error.message(cause), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    private GraphMatchException(ErrorMessage error, Throwable cause, Object... parameters) {
        super(error.message(parameters), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    private GraphMatchException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static GraphMatchException of(ErrorMessage errorMessage, Throwable cause) {
        return new GraphMatchException(errorMessage, cause);
    }

    public static GraphMatchException of(ErrorMessage errorMessage, Throwable cause, Object... parameters) {
        return new GraphMatchException(errorMessage, cause, parameters);
    }

    public static GraphMatchException of(ErrorMessage errorMessage, Object... parameters) {
        return new GraphMatchException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    public String code() {
        return error.code();
    }

    public boolean isInternal() {
        return error instanceof ErrorMessage.Internal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphMatchException that = (GraphMatchException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
