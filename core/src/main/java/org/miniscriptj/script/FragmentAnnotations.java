/*
 * Copyright 2024 the miniscriptj developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.miniscriptj.script;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * <p>Display hints for well known fragment names.</p>
 *
 * <p>This table is maintained by hand and only feeds labels and tooltips. It is not a grammar: names missing from
 * it parse and render like any other fragment, and an argument count that differs from {@link #expectedArity}
 * is not rejected.</p>
 */
public final class FragmentAnnotations {

    /** Arity of fragments that take any number of arguments. */
    public static final int VARIADIC = -1;

    private static final class Entry {
        final String annotation;
        final int arity;

        Entry(String annotation, int arity) {
            this.annotation = annotation;
            this.arity = arity;
        }
    }

    private static final Map<String, Entry> ENTRIES = ImmutableMap.<String, Entry>builder()
            // Keys
            .put("pk_k", new Entry("pushes a public key", 1))
            .put("pk_h", new Entry("pushes a key hash checked with OP_DUP OP_HASH160", 1))
            .put("pk", new Entry("uses a signature check (OP_CHECKSIG)", 1))
            .put("pkh", new Entry("uses a key hash and signature check", 1))
            // Timelocks
            .put("older", new Entry("uses a relative timelock (OP_CHECKSEQUENCEVERIFY)", 1))
            .put("after", new Entry("uses an absolute timelock (OP_CHECKLOCKTIMEVERIFY)", 1))
            // Hashlocks
            .put("sha256", new Entry("uses a hash preimage check (OP_SHA256)", 1))
            .put("hash256", new Entry("uses a hash preimage check (OP_HASH256)", 1))
            .put("ripemd160", new Entry("uses a hash preimage check (OP_RIPEMD160)", 1))
            .put("hash160", new Entry("uses a hash preimage check (OP_HASH160)", 1))
            // Conjunctions
            .put("and_v", new Entry("runs both sides, the first one verified", 2))
            .put("and_b", new Entry("runs both sides and combines them with OP_BOOLAND", 2))
            .put("and_n", new Entry("uses a conditional branch (OP_NOTIF)", 2))
            .put("andor", new Entry("uses a conditional branch (OP_NOTIF ... OP_ELSE)", 3))
            // Disjunctions
            .put("or_b", new Entry("runs both sides and combines them with OP_BOOLOR", 2))
            .put("or_c", new Entry("uses a conditional branch (OP_NOTIF)", 2))
            .put("or_d", new Entry("uses a conditional branch (OP_IFDUP OP_NOTIF)", 2))
            .put("or_i", new Entry("uses a conditional branch (OP_IF)", 2))
            // Thresholds and multisig
            .put("thresh", new Entry("adds up satisfied branches (OP_ADD ... OP_EQUAL)", VARIADIC))
            .put("multi", new Entry("uses a multi-check operation (OP_CHECKMULTISIG)", VARIADIC))
            .put("sortedmulti", new Entry("uses a multi-check operation over sorted keys (OP_CHECKMULTISIG)", VARIADIC))
            .put("multi_a", new Entry("uses a signature-add operation (OP_CHECKSIGADD)", VARIADIC))
            .put("sortedmulti_a", new Entry("uses a signature-add operation over sorted keys (OP_CHECKSIGADD)", VARIADIC))
            // Policy language
            .put("and", new Entry("requires both branches", 2))
            .put("or", new Entry("requires either branch", 2))
            .build();

    private static final ImmutableSet<String> COUNTED =
            ImmutableSet.of("thresh", "threshold", "multi", "sortedmulti", "multi_a", "sortedmulti_a");

    private FragmentAnnotations() {
    }

    /** Returns the display annotation for the given fragment name, or null if the name is not in the table. */
    @Nullable
    public static String annotationFor(String name) {
        Entry entry = ENTRIES.get(name);
        return entry == null ? null : entry.annotation;
    }

    /**
     * Returns the usual number of arguments of the named fragment, {@link #VARIADIC} if it takes any number, or
     * null if the name is not in the table.
     */
    @Nullable
    public static Integer expectedArity(String name) {
        Entry entry = ENTRIES.get(name);
        return entry == null ? null : entry.arity;
    }

    /**
     * True for fragments whose first argument is a count and whose remaining arguments are uniform children, such
     * as {@code thresh(2,pk(A),pk(B),pk(C))} or {@code multi(2,A,B,C)}.
     */
    public static boolean isCounted(String name) {
        return COUNTED.contains(name);
    }
}
