package com.charlib.tool.tree;

import java.util.List;
import java.util.Optional;

import com.charlib.tool.exception.TreeMutationException;

/**
 * A Liberty group such as {@code cell (INV1) { ... }}.
 */
public interface LibertyGroup {

    /**
     * The group type tag, e.g. {@code cell}, {@code pin}, {@code timing}.
     */
    String getGroupType();

    List<String> getNames();

    default Optional<String> getFirstName() {
        List<String> names = getNames();
        return names.isEmpty() ? Optional.empty() : Optional.of(names.get(0));
    }

    /**
     * Child groups in source order. The returned list is a snapshot.
     */
    List<LibertyGroup> getGroups();

    default List<LibertyGroup> getGroups(String groupType) {
        return getGroups().stream()
                .filter(g -> groupType.equals(g.getGroupType()))
                .toList();
    }

    /**
     * First attribute with the given name. Absence is not an error.
     */
    Optional<LibertyAttribute> findAttribute(String name);

    /**
     * @throws TreeMutationException if the attribute cannot be created
     */
    LibertyAttribute createAttribute(String name, AttributeType type);

    /**
     * @throws TreeMutationException if the attribute does not belong to this group
     */
    void deleteAttribute(LibertyAttribute attribute);

    /**
     * Appends an empty child group.
     *
     * @throws TreeMutationException if the group cannot be created
     */
    LibertyGroup createGroup(String groupType, List<String> names);
}
