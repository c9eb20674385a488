package com.datapatch.host;

import com.datapatch.value.DataValue;

import java.util.List;

/**
 * Creates a new root element for a selection block marked with a new-asset attribute.
 */
@FunctionalInterface
public interface AssetCreator {

    Selectable create(List<DataValue> arguments);
}
