package org.introspect.runtime;

import java.util.List;

/**
 * Implementation of a C function the interpreted code calls. Integers are passed as {@link Long}, pointers as
 * {@link CPointer} and floating values as {@link Double}.
 */
@FunctionalInterface
public interface CFunction {
    Object invoke(List<Object> arguments);
}
