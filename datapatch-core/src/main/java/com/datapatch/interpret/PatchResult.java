package com.datapatch.interpret;

import com.datapatch.diagnostics.PatchRuntimeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one run of a patch did and declared.
 *
 * @param stages           declared stages, name to unsigned priority, in declaration order
 * @param labels           asset labels from patch declarations
 * @param stageTags        stages of the blocks that ran on this pass
 * @param modifiedElements number of elements whose modification made at least one edit
 * @param error            the error that aborted the patch, or null
 */
public record PatchResult(
    Map<String, Long> stages,
    List<String> labels,
    Set<String> stageTags,
    int modifiedElements,
    PatchRuntimeException error
) {

    public PatchResult {
        stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        labels = List.copyOf(labels);
        stageTags = Collections.unmodifiableSet(new LinkedHashSet<>(stageTags));
    }

    public boolean succeeded() {
        return error == null;
    }
}
