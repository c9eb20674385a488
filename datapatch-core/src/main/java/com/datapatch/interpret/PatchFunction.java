package com.datapatch.interpret;

import com.datapatch.value.DataValue;

/**
 * A builtin or host-supplied function callable from patch code, by simple call
 * ({@code f(a, b)}) or member call ({@code a.f(b)}).
 */
@FunctionalInterface
public interface PatchFunction {

    DataValue invoke(Invocation invocation);
}
