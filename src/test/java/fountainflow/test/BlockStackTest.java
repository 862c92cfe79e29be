// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import fountainflow.generator.BlockStack;
import fountainflow.generator.BlockStack.Block;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class BlockStackTest {
    @Test
    void pushAndPopLeaveOriginalsUntouched() {
        final var empty = BlockStack.empty();
        final var withIf = empty.push(Block.IF);
        final var withMenu = withIf.push(Block.MENU);

        Assertions.assertThat(empty.isEmpty()).isTrue();
        Assertions.assertThat(empty.top()).isNull();
        Assertions.assertThat(withIf.top()).isEqualTo(Block.IF);
        Assertions.assertThat(withMenu.top()).isEqualTo(Block.MENU);
        Assertions.assertThat(withMenu.depth()).isEqualTo(2);
        Assertions.assertThat(withMenu.pop()).isSameAs(withIf);
        Assertions.assertThat(withIf.depth()).isEqualTo(1);
    }

    @Test
    void conditionalDepthIgnoresMenus() {
        final var stack = BlockStack.empty().push(Block.IF).push(Block.MENU).push(Block.ELSE);
        Assertions.assertThat(stack.conditionalDepth()).isEqualTo(2);
        Assertions.assertThat(stack).hasToString("[IF, MENU, ELSE]");
    }

    @Test
    void poppingEmptyStackIsAnError() {
        Assertions.assertThatThrownBy(() -> BlockStack.empty().pop()).isInstanceOf(IllegalStateException.class);
    }
}
