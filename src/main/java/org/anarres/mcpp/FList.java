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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import javax.annotation.Nonnull;

/**
 * A persistent singly-linked list.
 *
 * This is the work-list of the {@link Expander}: a replacement is
 * prepended to the unscanned remainder without copying it, and every
 * suffix keeps its size, so the expander can tell how far into the
 * original input a scan has advanced by comparing sizes.
 */
/* pp */ final class FList<E> extends AbstractList<E> {

    @SuppressWarnings("rawtypes")
    private static final FList EMPTY = new FList();

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <E> FList<E> empty() {
        return EMPTY;
    }

    @Nonnull
    public static <E> FList<E> from(@Nonnull List<E> list) {
        if (list instanceof FList)
            return (FList<E>) list;
        return concat(list, FList.<E>empty());
    }

    /** Returns the elements of the given list followed by the given tail. */
    @Nonnull
    public static <E> FList<E> concat(@Nonnull List<E> list, @Nonnull FList<E> tail) {
        List<E> elements = (list instanceof ArrayList) ? list : new ArrayList<>(list);
        for (int i = elements.size() - 1; i >= 0; i--)
            tail = new FList<>(elements.get(i), tail);
        return tail;
    }

    public final E cur;
    @Nonnull
    public final FList<E> next;
    public final int size;

    private FList() {
        this.cur = null;
        this.next = this;
        this.size = 0;
    }

    public FList(E cur, @Nonnull FList<E> next) {
        this.cur = cur;
        this.next = next;
        this.size = next.size + 1;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public E get(int index) {
        if (index < 0 || index >= size)
            throw new IndexOutOfBoundsException("Index " + index + " of " + size);
        FList<E> list = this;
        for (int i = 0; i < index; i++)
            list = list.next;
        return list.cur;
    }

    /** Returns this list with its head replaced. */
    @Nonnull
    public FList<E> withHead(E e) {
        if (size == 0)
            throw new NoSuchElementException("Empty list has no head.");
        return new FList<>(e, next);
    }

    @Override
    public java.util.Iterator<E> iterator() {
        return new java.util.Iterator<E>() {
            private FList<E> list = FList.this;

            @Override
            public boolean hasNext() {
                return list.size > 0;
            }

            @Override
            public E next() {
                if (list.size == 0)
                    throw new NoSuchElementException();
                E e = list.cur;
                list = list.next;
                return e;
            }
        };
    }
}
