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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into {@link Token}s. Every run of characters that are not {@code (}, {@code )} or
 * {@code ,} becomes a single name token; empty runs are dropped. Bracket balance is not checked here.
 */
public class ExpressionTokenizer {

    public List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<Token>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(' || c == ')' || c == ',') {
                flush(current, tokens);
                if (c == '(')
                    tokens.add(Token.OPEN);
                else if (c == ')')
                    tokens.add(Token.CLOSE);
                else
                    tokens.add(Token.COMMA);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(StringBuilder current, List<Token> tokens) {
        String name = current.toString().trim();
        if (!name.isEmpty())
            tokens.add(Token.name(name));
        current.setLength(0);
    }
}
