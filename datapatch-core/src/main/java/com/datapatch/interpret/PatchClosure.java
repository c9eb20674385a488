package com.datapatch.interpret;

import com.datapatch.value.DataValue;

import java.util.List;

/**
 * A closure passed as a call argument. Calling it runs its body in a scope nested in the
 * scope where it was written.
 */
@FunctionalInterface
public interface PatchClosure {

    DataValue call(List<DataValue> arguments);

    default DataValue call(DataValue... arguments) {
        return call(List.of(arguments));
    }
}
