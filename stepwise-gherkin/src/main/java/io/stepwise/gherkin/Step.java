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

import java.util.LinkedHashMap;
import java.util.Map;

public class Step {

    private final int line;
    private final String keyword;
    private final String text;
    private final String docString;
    private final Table table;

    public Step(int line, String keyword, String text) {
        this(line, keyword, text, null, null);
    }

    public Step(int line, String keyword, String text, String docString, Table table) {
        this.line = line;
        this.keyword = keyword == null ? "*" : keyword.trim();
        this.text = text;
        this.docString = docString;
        this.table = table;
    }

    /**
     * Returns a copy with every occurrence of the token replaced in the text,
     * the doc-string and the table cells.
     */
    public Step replace(String token, String value) {
        String replacedDoc = docString == null ? null : docString.replace(token, value);
        Table replacedTable = table == null ? null : table.replace(token, value);
        return new Step(line, keyword, text.replace(token, value), replacedDoc, replacedTable);
    }

    public int getLine() {
        return line;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public String getDocString() {
        return docString;
    }

    public Table getTable() {
        return table;
    }

    public String getPrefixedText() {
        return keyword + " " + text;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("line", line);
        map.put("keyword", keyword);
        map.put("text", text);
        if (docString != null) {
            map.put("docString", docString);
        }
        if (table != null) {
            map.put("table", table.getRows());
        }
        return map;
    }

    @Override
    public String toString() {
        return getPrefixedText();
    }

}
