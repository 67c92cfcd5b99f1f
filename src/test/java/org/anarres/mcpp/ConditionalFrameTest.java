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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionalFrameTest {

    private static final Token IF = new Token(TokenKind.IDENTIFIER, "if");

    @Test
    public void testTakenBranch() {
        ConditionalFrame frame = new ConditionalFrame(IF, true, true);
        assertTrue(frame.isActive());
        assertTrue(frame.isBranchTaken());
        assertFalse(frame.needsCondition());

        frame = frame.withBranch(true);
        assertFalse(frame.isActive());
        frame = frame.withElse();
        assertFalse(frame.isActive());
        assertTrue(frame.sawElse());
    }

    @Test
    public void testElifSelection() {
        ConditionalFrame frame = new ConditionalFrame(IF, true, false);
        assertFalse(frame.isActive());
        assertTrue(frame.needsCondition());

        frame = frame.withBranch(false);
        assertFalse(frame.isActive());
        frame = frame.withBranch(true);
        assertTrue(frame.isActive());
        assertTrue(frame.isBranchTaken());
        frame = frame.withBranch(true);
        assertFalse(frame.isActive());
        frame = frame.withElse();
        assertFalse(frame.isActive());
    }

    @Test
    public void testElseTakenWhenNothingElseWas() {
        ConditionalFrame frame = new ConditionalFrame(IF, true, false).withElse();
        assertTrue(frame.isActive());
        assertTrue(frame.sawElse());
        assertSame(IF, frame.getOpening());
    }

    @Test
    public void testInactiveParent() {
        ConditionalFrame frame = new ConditionalFrame(IF, false, true);
        assertFalse(frame.isParentActive());
        assertFalse(frame.isActive());
        assertFalse(frame.needsCondition());
        assertFalse(frame.withBranch(true).isActive());
        assertFalse(frame.withElse().isActive());
    }
}
