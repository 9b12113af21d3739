package com.tsa.config;

/**
 * One {@code (site, alias, condition)} input row. Fields may be missing;
 * such rows are skipped when the collection is built.
 *
 * @param row       1-based row number within the collection
 * @param site      Site name
 * @param alias     Master alias
 * @param condition Raw condition string
 */
public record ConditionRow(
        int row,
        String site,
        String alias,
        String condition
) {
    /**
     * Name of the first empty field, or null if the row is complete.
     */
    public String missingField() {
        if (isBlank(site)) {
            return "site";
        }
        if (isBlank(alias)) {
            return "alias";
        }
        if (isBlank(condition)) {
            return "condition";
        }
        return null;
    }

    public boolean isComplete() {
        return missingField() == null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
