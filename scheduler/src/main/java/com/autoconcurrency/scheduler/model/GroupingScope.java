package com.autoconcurrency.scheduler.model;

import java.util.Locale;
import java.util.Optional;

/**
 * What a group key is derived from when items are built from node ids
 * ({@code path/to/test_file.py::TestClass::test_name}).
 */
public enum GroupingScope {

    /** Everything before the first {@code ::}. */
    FILE,

    /** Directory of the file part; {@code "."} for top-level files. */
    PACKAGE;

    private static final String NODE_SEPARATOR = "::";

    public String groupKeyOf(String nodeId) {
        String file = fileOf(nodeId);
        if (this == FILE) {
            return file;
        }
        int slash = file.lastIndexOf('/');
        return slash > 0 ? file.substring(0, slash) : ".";
    }

    /** Lower-case option value, e.g. "file". */
    public String optionValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<GroupingScope> fromOptionValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (GroupingScope scope : values()) {
            if (scope.optionValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    private static String fileOf(String nodeId) {
        int sep = nodeId.indexOf(NODE_SEPARATOR);
        return sep >= 0 ? nodeId.substring(0, sep) : nodeId;
    }
}
