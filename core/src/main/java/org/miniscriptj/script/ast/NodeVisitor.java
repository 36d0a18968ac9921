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

package org.miniscriptj.script.ast;

/**
 * Double-dispatch over the concrete {@link ExpressionNode} classes.
 */
public interface NodeVisitor<T> {

    T visitTerminal(Terminal node);

    T visitWrapper(Wrapper node);

    T visitFragment(Fragment node);

    T visitTaprootRoot(TaprootRoot node);

    T visitTaprootBranch(TaprootBranch node);

    T visitTaprootLeaf(TaprootLeaf node);
}
