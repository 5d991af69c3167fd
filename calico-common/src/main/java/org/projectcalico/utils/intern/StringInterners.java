/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectcalico.utils.intern;

import org.projectcalico.annotation.PublicEvolving;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * Factory methods for {@link StringInterner}s backed by Guava {@link Interners}.
 *
 * @since 0.1
 */
@PublicEvolving
public final class StringInterners {

    private static final StringInterner NO_OP = value -> checkNotNull(value);

    /** Creates an interner that holds every canonical instance until it is garbage collected. */
    public static StringInterner strong() {
        return new GuavaStringInterner(Interners.newStrongInterner());
    }

    /** Creates an interner that only weakly references its canonical instances. */
    public static StringInterner weak() {
        return new GuavaStringInterner(Interners.newWeakInterner());
    }

    /** Returns an interner that hands back its input unchanged. */
    public static StringInterner noOp() {
        return NO_OP;
    }

    /** Returns a new interner for the given mode. */
    public static StringInterner forMode(InterningMode mode) {
        switch (checkNotNull(mode, "Interning mode must not be null.")) {
            case STRONG:
                return strong();
            case WEAK:
                return weak();
            case NONE:
                return noOp();
            default:
                throw new IllegalArgumentException("Unsupported interning mode: " + mode);
        }
    }

    private static final class GuavaStringInterner implements StringInterner {

        private final Interner<String> interner;

        private GuavaStringInterner(Interner<String> interner) {
            this.interner = interner;
        }

        @Override
        public String intern(String value) {
            return interner.intern(checkNotNull(value));
        }
    }

    private StringInterners() {}
}
