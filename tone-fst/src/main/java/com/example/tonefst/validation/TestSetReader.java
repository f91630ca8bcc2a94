package com.example.tonefst.validation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads test sets stored as comma separated values. The header names the columns; {@code form}
 * holds the input and {@code segmentation} the expected output. Rows without a segmentation are
 * skipped. Fields may be quoted with {@code "}, a doubled quote inside a quoted field stands for
 * itself.
 */
public final class TestSetReader {

    public static final String FORM_COLUMN = "form";
    public static final String SEGMENTATION_COLUMN = "segmentation";

    private TestSetReader() {
    }

    public static List<TestCase> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<TestCase> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            throw new TestSetException("Test set is empty");
        }
        if (header.startsWith("\uFEFF")) {
            header = header.substring(1);
        }
        List<String> columns = splitRow(header, 1);
        int formIndex = indexOf(columns, FORM_COLUMN);
        int segmentationIndex = indexOf(columns, SEGMENTATION_COLUMN);

        List<TestCase> cases = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitRow(line, lineNumber);
            String form = field(fields, formIndex);
            String segmentation = field(fields, segmentationIndex);
            if (segmentation.isEmpty()) {
                continue;
            }
            if (form.isEmpty()) {
                throw new TestSetException("Row " + lineNumber + " has a segmentation but no form");
            }
            cases.add(new TestCase(form, segmentation));
        }
        return cases;
    }

    private static int indexOf(List<String> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).strip().toLowerCase(Locale.ROOT).equals(name)) {
                return i;
            }
        }
        throw new TestSetException("Test set header lacks the '" + name + "' column: " + columns);
    }

    private static String field(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index).strip() : "";
    }

    static List<String> splitRow(String line, int lineNumber) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new TestSetException("Unterminated quote on line " + lineNumber);
        }
        fields.add(current.toString());
        return fields;
    }
}
