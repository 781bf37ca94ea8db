package com.flapmyport.plugins.jdbc;

import java.util.ArrayList;
import java.util.List;

/** Splits a plain DDL script into statements. No support for ';' inside literals. */
final class SqlScript {
    private SqlScript() {}

    static List<String> statements(String script) {
        StringBuilder clean = new StringBuilder(script.length());
        for (String line : script.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.startsWith("--")) continue;
            clean.append(line).append('\n');
        }
        List<String> out = new ArrayList<>();
        for (String part : clean.toString().split(";")) {
            String sql = part.strip();
            if (!sql.isEmpty()) out.add(sql);
        }
        return out;
    }
}
