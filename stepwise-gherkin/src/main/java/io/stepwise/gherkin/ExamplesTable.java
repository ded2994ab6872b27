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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExamplesTable {

    private final int line;
    private final String name;
    private final List<Tag> tags;
    private final Table table;

    public ExamplesTable(int line, String name, List<Tag> tags, Table table) {
        this.line = line;
        this.name = name;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.table = table;
    }

    public int getLine() {
        return line;
    }

    public String getName() {
        return name;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public Table getTable() {
        return table;
    }

    /**
     * @return the placeholder names, without angle brackets
     */
    public List<String> getHeader() {
        return table.getHeader();
    }

    /**
     * @return the body rows, header excluded
     */
    public List<List<String>> getBody() {
        List<List<String>> rows = table.getRows();
        return rows.isEmpty() ? Collections.emptyList() : rows.subList(1, rows.size());
    }

    public int getRowCount() {
        return getBody().size();
    }

    public Map<String, String> getExampleData(int rowIndex) {
        List<String> header = getHeader();
        List<String> row = getBody().get(rowIndex);
        Map<String, String> map = new LinkedHashMap<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            map.put(header.get(i), i < row.size() ? row.get(i) : "");
        }
        return map;
    }

}
