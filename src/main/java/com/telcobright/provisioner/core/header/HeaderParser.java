package com.telcobright.provisioner.core.header;

import com.telcobright.provisioner.core.exception.HeaderFormatException;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Reads the three-line dataset header from the shared input cursor.
 *
 * <pre>
 * tags,hostname,region,datacenter
 * cpu,usage_user,usage_system
 * (blank)
 * </pre>
 *
 * After a successful call the reader is positioned at the first data line, which
 * is where the row loader picks up.
 */
public class HeaderParser {

    private static final int HEADER_LINES = 3;

    public HeaderDescriptor parse(BufferedReader reader) {
        String tags = null;
        String columns = null;

        for (int i = 0; i < HEADER_LINES; i++) {
            String line = readLine(reader, i + 1);
            if (i == 0) {
                tags = line;
            } else if (i == 1) {
                columns = line;
            } else if (!line.isEmpty()) {
                throw new HeaderFormatException("input has wrong header format: third line is not blank");
            }
        }

        if (tags.isEmpty()) {
            throw new HeaderFormatException("input has wrong header format: tag line is blank");
        }
        if (columns.isEmpty()) {
            throw new HeaderFormatException("input has wrong header format: column line is blank");
        }
        return HeaderDescriptor.fromLines(tags, columns);
    }

    private String readLine(BufferedReader reader, int lineNumber) {
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new HeaderFormatException("input has wrong header format: " + e.getMessage(), e);
        }
        if (line == null) {
            throw new HeaderFormatException(
                "input has wrong header format: stream ended before header line " + lineNumber);
        }
        return line.trim();
    }
}
