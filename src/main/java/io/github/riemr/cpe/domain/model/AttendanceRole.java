package io.github.riemr.cpe.domain.model;

public enum AttendanceRole {
    HOST("host details", "host"),
    ATTENDEE("attendee details", "attendee"),
    PANELIST("panelist details", "panelist");

    private final String tableName;
    private final String tag;

    AttendanceRole(String tableName, String tag) {
        this.tableName = tableName;
        this.tag = tag;
    }

    public String getTableName() {
        return tableName;
    }

    public String getTag() {
        return tag;
    }
}
