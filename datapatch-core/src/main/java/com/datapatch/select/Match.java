package com.datapatch.select;

import com.datapatch.host.Selectable;

import java.util.ArrayList;
import java.util.List;

/**
 * A selected element together with its ancestors, outermost first.
 */
public record Match(Selectable element, List<Selectable> ancestors) {

    public Match {
        ancestors = List.copyOf(ancestors);
    }

    public List<Selectable> ancestorsAndSelf() {
        List<Selectable> path = new ArrayList<>(ancestors);
        path.add(element);
        return path;
    }
}
