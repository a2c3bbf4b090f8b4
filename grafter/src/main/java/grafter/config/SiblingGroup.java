// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import java.util.List;

/**
 * An ordered sequence of keywords whose clauses combine into one node when they follow each other, such as
 * {@code if}, {@code elseif}, {@code else}.
 * <p>
 * The first keyword opens a group; the others may follow it in declared order, each any number of times.
 */
public record SiblingGroup(String name, List<String> keywords) {
    public SiblingGroup {
        keywords = List.copyOf(keywords);
    }

    /**
     * Retrieves the keyword that opens the group.
     */
    public String opener() {
        return keywords.get(0);
    }

    /**
     * Returns the position of {@code keyword} in this group, or -1 if it's not a member.
     */
    public int indexOf(final String keyword) {
        return keywords.indexOf(keyword);
    }
}
