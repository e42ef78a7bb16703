package com.autoconcurrency.scheduler.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GroupingScopeTest {

    @Test
    void file_isPartBeforeFirstSeparator() {
        assertThat(GroupingScope.FILE.groupKeyOf("tests/db/test_users.py::TestUsers::test_insert"))
                .isEqualTo("tests/db/test_users.py");
    }

    @Test
    void package_isDirectoryOfFile() {
        assertThat(GroupingScope.PACKAGE.groupKeyOf("tests/db/test_users.py::test_insert"))
                .isEqualTo("tests/db");
    }

    @Test
    void package_topLevelFile_isDot() {
        assertThat(GroupingScope.PACKAGE.groupKeyOf("test_root.py::test_a")).isEqualTo(".");
    }

    @Test
    void fromOptionValue_caseInsensitive_unknownEmpty() {
        assertThat(GroupingScope.fromOptionValue("Package")).contains(GroupingScope.PACKAGE);
        assertThat(GroupingScope.fromOptionValue("module")).isEmpty();
        assertThat(GroupingScope.fromOptionValue(null)).isEmpty();
    }

    @Test
    void workItem_fromNodeId_derivesGroupKey() {
        WorkItem item = WorkItem.fromNodeId("tests/test_a.py::test_one", GroupingScope.FILE, () -> {});

        assertThat(item.id()).isEqualTo("tests/test_a.py::test_one");
        assertThat(item.groupKey()).isEqualTo("tests/test_a.py");
    }

    @Test
    void workItem_emptyGroupKey_meansNoGroup() {
        assertThat(WorkItem.grouped("x", "", () -> {}).hasGroup()).isFalse();
    }
}
