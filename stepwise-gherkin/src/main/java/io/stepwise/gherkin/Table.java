/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stepwise.gherkin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data table attached to a step, or the rows of an examples table.
 * The first row is treated as the header where a header is meaningful.
 */
public class Table {

    private final int line;
    private final List<List<String>> rows;

    public Table(int line, List<List<String>> rows) {
        this.line = line;
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            temp.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(temp);
    }

    public int getLine() {
        return line;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<String> getHeader() {
        return rows.isEmpty() ? Collections.emptyList() : rows.get(0);
    }

    public String getValue(int row, int col) {
        return rows.get(row).get(col);
    }

    /**
     * @return every row after the header as a map keyed by header cell
     */
    public List<Map<String, String>> getRowsAsMaps() {
        List<String> header = getHeader();
        List<Map<String, String>> list = new ArrayList<>(Math.max(0, rows.size() - 1));
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            Map<String, String> map = new LinkedHashMap<>(header.size());
            for (int j = 0; j < header.size() && j < row.size(); j++) {
                map.put(header.get(j), row.get(j));
            }
            list.add(map);
        }
        return list;
    }

    public Table replace(String token, String value) {
        List<List<String>> replaced = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> temp = new ArrayList<>(row.size());
            for (String cell : row) {
                temp.add(cell.replace(token, value));
            }
            replaced.add(temp);
        }
        return new Table(line, replaced);
    }

    @Override
    public String toString() {
        return rows.toString();
    }

}
