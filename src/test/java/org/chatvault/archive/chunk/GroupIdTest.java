package org.chatvault.archive.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class GroupIdTest {

    @Test
    void compositeKeysUseTypePrefixAndColon() {
        assertThat(GroupId.channel("C1").value()).isEqualTo("C1");
        assertThat(GroupId.thread("C1", "1000.001").value()).isEqualTo("t:C1:1000.001");
        assertThat(GroupId.file("C1", "1000.002").value()).isEqualTo("f:C1:1000.002");
        assertThat(GroupId.channelInfo("C1").value()).isEqualTo("ic:C1");
        assertThat(GroupId.channelUsers("C1").value()).isEqualTo("lcu:C1");
        assertThat(GroupId.bookmarks("C1").value()).isEqualTo("lb:C1");
    }

    @Test
    void staticKeysResolveToConstants() {
        assertThat(GroupId.of("lusr")).isSameAs(GroupId.USERS);
        assertThat(GroupId.of("lch")).isSameAs(GroupId.CHANNELS);
        assertThat(GroupId.of("ls")).isSameAs(GroupId.STARRED_ITEMS);
        assertThat(GroupId.of("iw")).isSameAs(GroupId.WORKSPACE_INFO);
    }

    @Test
    void equalKeysAreInterchangeable() {
        assertThat(GroupId.thread("C1", "1.5")).isEqualTo(GroupId.of("t:C1:1.5"));
        assertThat(GroupId.thread("C1", "1.5")).hasSameHashCodeAs(GroupId.of("t:C1:1.5"));
        assertThat(GroupId.thread("C1", "1.5")).isNotEqualTo(GroupId.file("C1", "1.5"));
    }

    @Test
    void classifiesKeys() {
        assertThat(GroupId.channel("C1").isChannel()).isTrue();
        assertThat(GroupId.thread("C1", "1.5").isChannel()).isFalse();
        assertThat(GroupId.USERS.isChannel()).isFalse();
        // a channel ID starting with 'i' is not an info key
        assertThat(GroupId.channel("ic1").isInfo()).isFalse();

        assertThat(GroupId.channelInfo("C1").isInfo()).isTrue();
        assertThat(GroupId.WORKSPACE_INFO.isInfo()).isTrue();
        assertThat(GroupId.USERS.isList()).isTrue();
        assertThat(GroupId.STARRED_ITEMS.isList()).isTrue();
        assertThat(GroupId.channelUsers("C1").isList()).isTrue();
        assertThat(GroupId.bookmarks("C1").isList()).isTrue();
        assertThat(GroupId.channel("L1").isList()).isFalse();
    }

    @Test
    void rejectsEmptyKey() {
        assertThatThrownBy(() -> GroupId.of(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
