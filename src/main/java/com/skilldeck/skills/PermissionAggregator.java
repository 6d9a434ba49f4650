package com.skilldeck.skills;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Unions the tool restrictions of active skills.
 *
 * <p>Restrictions are additive: activating a restrictive skill still allows every tool named by
 * any other active skill. Callers that need isolation must not rely on this for it.
 */
public class PermissionAggregator {

    /**
     * @return null when no record declares restrictions (everything allowed), otherwise the
     *         union of all declared tool names in ranking order
     */
    public List<String> aggregate(Collection<ActivationRecord> records) {
        var union = new LinkedHashSet<String>();
        for (var r : ContentAssembler.ranked(records)) {
            union.addAll(r.toolRestrictions());
        }
        return union.isEmpty() ? null : new ArrayList<>(union);
    }
}
