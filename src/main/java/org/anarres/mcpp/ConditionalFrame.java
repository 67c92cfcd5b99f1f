/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.mcpp;

import javax.annotation.Nonnull;

/**
 * The state of one conditional group, from #if to #endif.
 *
 * Frames are immutable; each directive replaces the top of the stack
 * with a modified copy.
 */
/* pp */ final class ConditionalFrame {

    private final Token opening;
    private final boolean parentActive;
    private final boolean branchTaken;
    private final boolean active;
    private final boolean sawElse;

    private ConditionalFrame(@Nonnull Token opening, boolean parentActive,
            boolean branchTaken, boolean active, boolean sawElse) {
        this.opening = opening;
        this.parentActive = parentActive;
        this.branchTaken = branchTaken;
        this.active = active;
        this.sawElse = sawElse;
    }

    /**
     * Opens a group. The branch is active only if the enclosing region
     * is active and the condition holds.
     */
    /* pp */ ConditionalFrame(@Nonnull Token opening, boolean parentActive, boolean condition) {
        this(opening, parentActive, parentActive && condition, parentActive && condition, false);
    }

    /* The directive which opened this group. */
    @Nonnull
    /* pp */ Token getOpening() {
        return opening;
    }

    /* pp */ boolean isParentActive() {
        return parentActive;
    }

    /* pp */ boolean isBranchTaken() {
        return branchTaken;
    }

    /* pp */ boolean isActive() {
        return active;
    }

    /* pp */ boolean sawElse() {
        return sawElse;
    }

    /** Enters an #elif branch whose condition evaluated to the given value. */
    @Nonnull
    /* pp */ ConditionalFrame withBranch(boolean condition) {
        boolean now = parentActive && !branchTaken && condition;
        return new ConditionalFrame(opening, parentActive, branchTaken || now, now, sawElse);
    }

    /** Enters the #else branch. */
    @Nonnull
    /* pp */ ConditionalFrame withElse() {
        boolean now = parentActive && !branchTaken;
        return new ConditionalFrame(opening, parentActive, true, now, true);
    }

    /**
     * Returns true if an #elif condition must be evaluated, that is,
     * if no earlier branch was taken in an active region.
     */
    /* pp */ boolean needsCondition() {
        return parentActive && !branchTaken;
    }

    @Override
    public String toString() {
        return "parent=" + parentActive
                + ", taken=" + branchTaken
                + ", active=" + active
                + ", sawelse=" + sawElse;
    }
}
