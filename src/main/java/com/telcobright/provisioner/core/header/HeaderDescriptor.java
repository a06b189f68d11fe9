package com.telcobright.provisioner.core.header;

import java.util.Arrays;
import java.util.List;

/**
 * Parsed dataset header.
 *
 * <p>The tag line starts with the {@code tags} marker followed by tag names;
 * the column line starts with the hypertable name followed by field names.
 */
public class HeaderDescriptor {

    public static final String TAGS_MARKER = "tags";

    private final List<String> tagLine;
    private final List<String> columnLine;

    public HeaderDescriptor(List<String> tagLine, List<String> columnLine) {
        this.tagLine = List.copyOf(tagLine);
        this.columnLine = List.copyOf(columnLine);
    }

    /**
     * Build a descriptor from the two raw (already trimmed) header lines.
     */
    public static HeaderDescriptor fromLines(String tags, String columns) {
        return new HeaderDescriptor(split(tags), split(columns));
    }

    static List<String> split(String line) {
        // -1 keeps trailing empty names, they are skipped later but still count for position
        return Arrays.asList(line.trim().split(",", -1));
    }

    public List<String> getTagLine() { return tagLine; }
    public List<String> getColumnLine() { return columnLine; }

    public String getMarker() {
        return tagLine.get(0);
    }

    public List<String> getTagNames() {
        return tagLine.subList(1, tagLine.size());
    }

    public String getHypertableName() {
        return columnLine.get(0);
    }

    public List<String> getFieldNames() {
        return columnLine.subList(1, columnLine.size());
    }

    @Override
    public String toString() {
        return String.format("Header[tags=%s, columns=%s]", tagLine, columnLine);
    }
}
