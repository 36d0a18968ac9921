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

package org.miniscriptj.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Structural problems found while splitting or parsing an expression. Each value carries a stable mnemonic
 * that test vectors and callers can match on.
 */
public enum ExpressionError {

    UNBALANCED_BRACKETS("EXPR_ERR_UNBALANCED_BRACKETS"),
    DANGLING_WRAPPER("EXPR_ERR_DANGLING_WRAPPER"),
    UNKNOWN_WRAPPER_TAG("EXPR_ERR_UNKNOWN_WRAPPER_TAG"),
    EMPTY_ARGUMENT("EXPR_ERR_EMPTY_ARGUMENT"),
    TRAILING_CHARACTERS("EXPR_ERR_TRAILING_CHARACTERS"),
    INVALID_FRAGMENT_NAME("EXPR_ERR_INVALID_FRAGMENT_NAME"),
    UNTERMINATED_SPLIT("EXPR_ERR_UNTERMINATED_SPLIT"),
    MISSING_INTERNAL_KEY("EXPR_ERR_MISSING_INTERNAL_KEY"),
    MALFORMED_TREE("EXPR_ERR_MALFORMED_TREE"),
    NESTING_TOO_DEEP("EXPR_ERR_NESTING_TOO_DEEP");

    private final String mnemonic;
    private static final Map<String, ExpressionError> mnemonicToErrorMap;

    ExpressionError(String name) {
        this.mnemonic = name;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * Looks up an error by its mnemonic, returning null if there is no such error.
     */
    public static ExpressionError fromMnemonic(String name) {
        return mnemonicToErrorMap.get(name);
    }

    static {
        mnemonicToErrorMap = new HashMap<String, ExpressionError>();
        for (ExpressionError err : ExpressionError.values()) {
            mnemonicToErrorMap.put(err.getMnemonic(), err);
        }
    }
}
