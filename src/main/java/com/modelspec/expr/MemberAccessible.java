package com.modelspec.expr;

import java.util.Set;

/**
 * Implemented by objects whose properties expressions may read with {@code a.b}.
 */
public interface MemberAccessible {

    Set<String> memberNames();

    /**
     * Value of the named member. Only called with names from {@link #memberNames()}.
     */
    Object member(String name);
}
